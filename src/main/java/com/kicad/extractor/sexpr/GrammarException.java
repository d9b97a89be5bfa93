package com.kicad.extractor.sexpr;

/**
 * Raised when schematic text is not a well-formed S-expression.
 * Parsing is all-or-nothing: no partial tree is ever returned alongside this exception.
 */
public class GrammarException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public GrammarException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
