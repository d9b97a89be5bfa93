package com.kicad.extractor.sexpr;

import java.util.Objects;

/**
 * Leaf node: a bare symbol or a quoted string.
 */
public final class SexprAtom extends SexprNode {

    private final String text;
    private final boolean quoted;

    public SexprAtom(String text, boolean quoted, int line, int column) {
        super(line, column);
        this.text = Objects.requireNonNull(text, "text");
        this.quoted = quoted;
    }

    public static SexprAtom symbol(String text) {
        return new SexprAtom(text, false, 0, 0);
    }

    public static SexprAtom string(String text) {
        return new SexprAtom(text, true, 0, 0);
    }

    public String getText() {
        return text;
    }

    /**
     * Whether the atom was written as a quoted string. Informational only.
     */
    public boolean isQuoted() {
        return quoted;
    }

    @Override
    public <R> R accept(SexprNodeVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    // Position is not part of identity.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SexprAtom other)) return false;
        return quoted == other.quoted && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, quoted);
    }
}
