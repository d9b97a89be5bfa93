package com.kicad.extractor.config;

import com.kicad.extractor.extract.PropertyScope;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for one extraction run. Defaults: recursive property resolution and
 * plain {@code label} lists only.
 */
@Value
@Builder(toBuilder = true)
public class ExtractorConfig {

    /**
     * Scope used when resolving symbol properties.
     */
    @NonNull
    @Builder.Default
    PropertyScope propertyScope = PropertyScope.RECURSIVE;

    /**
     * Whether global and hierarchical labels also produce label nets.
     */
    boolean includeGlobalLabels;

    public static ExtractorConfig defaults() {
        return ExtractorConfig.builder().build();
    }
}
