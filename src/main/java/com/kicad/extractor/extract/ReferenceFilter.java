package com.kicad.extractor.extract;

import lombok.experimental.UtilityClass;

/**
 * Tells placed component instances apart from library template symbols.
 *
 * A template carries a bare designator prefix such as {@code R} or {@code U};
 * a placed instance is annotated with a number ({@code R1}, {@code U3}).
 */
@UtilityClass
public class ReferenceFilter {

    public boolean isPlacedReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            return false;
        }
        for (int i = 0; i < reference.length(); i++) {
            if (Character.isDigit(reference.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
