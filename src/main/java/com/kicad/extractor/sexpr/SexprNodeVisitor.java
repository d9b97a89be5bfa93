package com.kicad.extractor.sexpr;

/**
 * Visitor pattern interface for traversing the S-expression tree.
 */
public interface SexprNodeVisitor<R> {
    R visitAtom(SexprAtom atom);
    R visitList(SexprList list);
}
