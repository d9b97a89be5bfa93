package com.kicad.extractor.extract;

/**
 * How far below a symbol the property resolver looks.
 */
public enum PropertyScope {
    /**
     * Every {@code property} list anywhere below the symbol, including those of
     * nested symbols. First occurrence of a key wins, so the symbol's own
     * properties shadow those of its descendants.
     */
    RECURSIVE,

    /**
     * Only {@code property} lists that are immediate children of the symbol.
     */
    DIRECT
}
