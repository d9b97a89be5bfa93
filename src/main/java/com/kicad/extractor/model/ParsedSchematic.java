package com.kicad.extractor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The extracted design model: components, candidate nets and footprint suggestions.
 *
 * Collections are copied on construction and keep their order; the suggestion
 * table keeps component order.
 */
@Value
@JsonPropertyOrder({"components", "nets", "footprint_suggestions"})
public class ParsedSchematic {

    List<Component> components;

    List<Net> nets;

    @JsonProperty("footprint_suggestions")
    Map<String, String> footprintSuggestions;

    @Builder(toBuilder = true)
    public ParsedSchematic(List<Component> components, List<Net> nets, Map<String, String> footprintSuggestions) {
        this.components = components == null ? List.of() : List.copyOf(components);
        this.nets = nets == null ? List.of() : List.copyOf(nets);
        this.footprintSuggestions = footprintSuggestions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(footprintSuggestions));
    }

    public static ParsedSchematic empty() {
        return ParsedSchematic.builder().build();
    }

    public ParsedSchematic withNets(List<Net> replacement) {
        return toBuilder().nets(replacement).build();
    }
}
