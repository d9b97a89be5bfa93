package com.kicad.extractor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A placed schematic component.
 *
 * Pure structure only. The reference designator of every extracted component
 * contains at least one digit.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"ref", "value", "footprint", "lib_id"})
public class Component {

    /**
     * Reference designator (e.g. R1, U3).
     */
    @NonNull
    String ref;

    @NonNull
    @Builder.Default
    String value = "";

    /**
     * Footprint assigned in the schematic, empty when none was set.
     */
    @NonNull
    @Builder.Default
    String footprint = "";

    /**
     * Library symbol the instance was placed from (e.g. Device:R).
     */
    @NonNull
    @Builder.Default
    @JsonProperty("lib_id")
    String libId = "";
}
