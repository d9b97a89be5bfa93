package com.kicad.extractor.extract;

import com.kicad.extractor.model.Component;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link ComponentExtractor}: components in document order plus the
 * footprint suggestion for each of them.
 */
@Value
@Builder
public class ComponentExtraction {
    List<Component> components;
    Map<String, String> footprintSuggestions;
    int symbolsVisited;
    int symbolsFiltered;
}
