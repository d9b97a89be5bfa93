package com.kicad.extractor.sexpr;

/**
 * Base class for the two S-expression node kinds.
 *
 * A node is either an {@link SexprAtom} or an {@link SexprList}; the variant is
 * fixed by the parser and nodes are immutable afterwards.
 */
public abstract sealed class SexprNode permits SexprAtom, SexprList {

    private final int line;
    private final int column;

    protected SexprNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public abstract <R> R accept(SexprNodeVisitor<R> visitor);

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return SexprWriter.compact(this);
    }
}
