package com.kicad.extractor.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FootprintSuggester.
 */
class FootprintSuggesterTest {

    private final FootprintSuggester suggester = new FootprintSuggester();

    @Test
    void testKnownPrefixes() {
        assertThat(suggester.suggest("R12")).isEqualTo(FootprintSuggester.RESISTOR_0603);
        assertThat(suggester.suggest("C3")).isEqualTo(FootprintSuggester.CAPACITOR_0603);
        assertThat(suggester.suggest("U1")).isEqualTo(FootprintSuggester.SOIC_8);
        assertThat(suggester.suggest("J2")).isEqualTo(FootprintSuggester.PIN_HEADER_1X02);
        assertThat(suggester.suggest("TP4")).isEqualTo(FootprintSuggester.TEST_POINT_PAD);
    }

    @Test
    void testTestPointRuleComesFirst() {
        assertThat(suggester.getRules().get(0).getPrefix()).isEqualTo("TP");
        assertThat(suggester.getRules()).extracting(FootprintSuggester.PrefixRule::getPrefix)
                .containsExactly("TP", "R", "C", "U", "J");
    }

    @Test
    void testUnknownPrefixGetsDefault() {
        assertThat(suggester.suggest("D1")).isEqualTo(FootprintSuggester.DEFAULT_FOOTPRINT);
        assertThat(suggester.suggest("VDD_TP1")).isEqualTo(FootprintSuggester.DEFAULT_FOOTPRINT);
        assertThat(suggester.suggest(null)).isEqualTo(FootprintSuggester.DEFAULT_FOOTPRINT);
    }

    @Test
    void testPrefixMatchIsCaseSensitive() {
        assertThat(suggester.suggest("tp1")).isEqualTo(FootprintSuggester.DEFAULT_FOOTPRINT);
        assertThat(suggester.suggest("c1")).isEqualTo(FootprintSuggester.DEFAULT_FOOTPRINT);
    }
}
