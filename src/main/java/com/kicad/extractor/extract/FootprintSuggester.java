package com.kicad.extractor.extract;

import lombok.Value;

import java.util.List;

/**
 * Maps a reference designator to a default footprint by its prefix.
 *
 * The table is evaluated top-down and the first matching prefix wins, so longer
 * prefixes must precede any shorter prefix they start with ({@code TP} before a
 * hypothetical {@code T}). References that match nothing get {@link #DEFAULT_FOOTPRINT}.
 */
public class FootprintSuggester {

    public static final String RESISTOR_0603 = "Resistor_SMD:R_0603";
    public static final String CAPACITOR_0603 = "Capacitor_SMD:C_0603";
    public static final String SOIC_8 = "Package_SO:SOIC-8_3.9x4.9mm_P1.27mm";
    public static final String PIN_HEADER_1X02 = "Connector_PinHeader_2.54mm:PinHeader_1x02_P2.54mm_Vertical";
    public static final String TEST_POINT_PAD = "TestPoint:TestPoint_Pad_D1.0mm";

    public static final String DEFAULT_FOOTPRINT = RESISTOR_0603;

    private static final List<PrefixRule> RULES = List.of(
            new PrefixRule("TP", TEST_POINT_PAD),
            new PrefixRule("R", RESISTOR_0603),
            new PrefixRule("C", CAPACITOR_0603),
            new PrefixRule("U", SOIC_8),
            new PrefixRule("J", PIN_HEADER_1X02)
    );

    public String suggest(String reference) {
        if (reference != null) {
            for (PrefixRule rule : RULES) {
                if (reference.startsWith(rule.getPrefix())) {
                    return rule.getFootprint();
                }
            }
        }
        return DEFAULT_FOOTPRINT;
    }

    public List<PrefixRule> getRules() {
        return RULES;
    }

    @Value
    public static class PrefixRule {
        String prefix;
        String footprint;
    }
}
