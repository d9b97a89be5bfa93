package com.kicad.extractor.sexpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parenthesized list of nodes. By convention the first element is a keyword atom.
 */
public final class SexprList extends SexprNode {

    private final List<SexprNode> children;

    public SexprList(List<SexprNode> children, int line, int column) {
        super(line, column);
        this.children = List.copyOf(children);
    }

    public static SexprList of(SexprNode... children) {
        return new SexprList(Arrays.asList(children), 0, 0);
    }

    public List<SexprNode> getChildren() {
        return children;
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public SexprNode get(int index) {
        return children.get(index);
    }

    /**
     * Text of the leading atom, or empty if the list is empty or starts with a list.
     */
    public Optional<String> keyword() {
        return atomText(0);
    }

    public boolean hasKeyword(String keyword) {
        return keyword().map(keyword::equals).orElse(false);
    }

    /**
     * Text of the atom at {@code index}; empty when out of range or when the element is a list.
     */
    public Optional<String> atomText(int index) {
        if (index < 0 || index >= children.size()) {
            return Optional.empty();
        }
        if (children.get(index) instanceof SexprAtom atom) {
            return Optional.of(atom.getText());
        }
        return Optional.empty();
    }

    /**
     * Child lists only, in document order.
     */
    public List<SexprList> childLists() {
        List<SexprList> lists = new ArrayList<>();
        for (SexprNode child : children) {
            if (child instanceof SexprList list) {
                lists.add(list);
            }
        }
        return lists;
    }

    @Override
    public <R> R accept(SexprNodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SexprList other)) return false;
        return children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }
}
