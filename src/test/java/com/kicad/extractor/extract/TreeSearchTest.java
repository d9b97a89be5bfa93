package com.kicad.extractor.extract;

import com.kicad.extractor.sexpr.SexprList;
import com.kicad.extractor.sexpr.SexprParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TreeSearch.
 */
class TreeSearchTest {

    private final SexprParser parser = new SexprParser();

    @Test
    void testFindAllReturnsMatchesInDocumentOrder() {
        SexprList root = parser.parse("(sch (a 1) (b (a 2)) (a 3))");

        List<SexprList> matches = TreeSearch.findAll("a", root);

        assertThat(matches).extracting(l -> l.atomText(1).orElse(""))
                .containsExactly("1", "2", "3");
    }

    @Test
    void testNestedMatchFollowsItsAncestor() {
        SexprList root = parser.parse("(sch (symbol \"outer\" (symbol \"inner\")) (symbol \"next\"))");

        assertThat(TreeSearch.findAll("symbol", root))
                .extracting(l -> l.atomText(1).orElse(""))
                .containsExactly("outer", "inner", "next");
    }

    @Test
    void testRootItselfCanMatch() {
        SexprList root = parser.parse("(label \"VDD\")");

        assertThat(TreeSearch.findAll("label", root)).containsExactly(root);
    }

    @Test
    void testKeywordMustBeLeadingAtom() {
        SexprList root = parser.parse("(sch (x label) (\"label\" quoted) ((label) inner))");

        List<SexprList> matches = TreeSearch.findAll("label", root);

        // quoted atoms count; atoms in other positions do not
        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).atomText(1)).contains("quoted");
        assertThat(matches.get(1).size()).isEqualTo(1);
    }

    @Test
    void testMatchingIsCaseSensitive() {
        SexprList root = parser.parse("(sch (Label a) (LABEL b))");

        assertThat(TreeSearch.findAll("label", root)).isEmpty();
    }

    @Test
    void testFindAnyKeepsDocumentOrderAcrossKeywords() {
        SexprList root = parser.parse("(sch (global_label G) (label L) (x (hierarchical_label H)))");

        assertThat(TreeSearch.findAny(Set.of("label", "global_label", "hierarchical_label"), root))
                .extracting(l -> l.atomText(1).orElse(""))
                .containsExactly("G", "L", "H");
    }

    @Test
    void testFindChildrenIsNotRecursive() {
        SexprList root = parser.parse("(symbol (property a) (nested (property b)) (property c))");

        assertThat(TreeSearch.findChildren("property", root))
                .extracting(l -> l.atomText(1).orElse(""))
                .containsExactly("a", "c");
        assertThat(TreeSearch.findChild("property", root)).get()
                .extracting(l -> l.atomText(1).orElse(""))
                .isEqualTo("a");
        assertThat(TreeSearch.findChild("missing", root)).isEmpty();
    }
}
