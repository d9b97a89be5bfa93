package com.kicad.extractor.extract;

import com.kicad.extractor.sexpr.SexprList;
import com.kicad.extractor.sexpr.SexprNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Keyword search over an S-expression tree.
 */
@UtilityClass
public class TreeSearch {

    /**
     * Find every list whose first element is an atom equal to {@code keyword}.
     *
     * <p>Visits the whole tree in pre-order (document order), including {@code root}
     * itself. Matching lists are searched as well, so a match nested inside another
     * match is reported after its ancestor. Callers that need scoping must apply it
     * themselves.
     *
     * @param keyword exact, case-sensitive keyword
     * @param root    node to search
     * @return matching lists in document order
     */
    public List<SexprList> findAll(String keyword, SexprNode root) {
        return findAny(Set.of(keyword), root);
    }

    /**
     * Like {@link #findAll(String, SexprNode)} but matches any of several keywords
     * in a single pass, so results of different keywords stay in document order.
     */
    public List<SexprList> findAny(Set<String> keywords, SexprNode root) {
        List<SexprList> matches = new ArrayList<>();
        Deque<SexprNode> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            SexprNode node = pending.pop();
            if (!(node instanceof SexprList list)) {
                continue;
            }
            if (list.keyword().map(keywords::contains).orElse(false)) {
                matches.add(list);
            }
            List<SexprNode> children = list.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return matches;
    }

    /**
     * Immediate children of {@code list} headed by {@code keyword}, in order. Not recursive.
     */
    public List<SexprList> findChildren(String keyword, SexprList list) {
        List<SexprList> matches = new ArrayList<>();
        for (SexprList child : list.childLists()) {
            if (child.hasKeyword(keyword)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * First immediate child of {@code list} headed by {@code keyword}.
     */
    public Optional<SexprList> findChild(String keyword, SexprList list) {
        List<SexprList> matches = findChildren(keyword, list);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}
