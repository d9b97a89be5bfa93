package com.kicad.extractor.extract;

import com.kicad.extractor.model.Component;
import com.kicad.extractor.sexpr.SexprList;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds component records from every {@code symbol} list in a schematic.
 *
 * Symbols without a numbered reference are library templates (for example the
 * entries of {@code lib_symbols}) and are skipped.
 */
@RequiredArgsConstructor
public class ComponentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ComponentExtractor.class);

    static final String SYMBOL = "symbol";
    static final String LIB_ID = "lib_id";

    private final PropertyResolver propertyResolver;
    private final FootprintSuggester footprintSuggester;

    public ComponentExtractor() {
        this(new PropertyResolver(), new FootprintSuggester());
    }

    public ComponentExtraction extract(SexprList root) {
        List<Component> components = new ArrayList<>();
        Map<String, String> suggestions = new LinkedHashMap<>();
        int visited = 0;
        int filtered = 0;

        for (SexprList symbol : TreeSearch.findAll(SYMBOL, root)) {
            visited++;
            Map<String, String> properties = propertyResolver.propertiesOf(symbol);
            String ref = properties.getOrDefault(PropertyResolver.REFERENCE, "");

            if (!ReferenceFilter.isPlacedReference(ref)) {
                filtered++;
                log.debug("Skipping template symbol '{}' at line {}", ref, symbol.getLine());
                continue;
            }

            Component component = Component.builder()
                    .ref(ref)
                    .value(properties.getOrDefault(PropertyResolver.VALUE, ""))
                    .footprint(properties.getOrDefault(PropertyResolver.FOOTPRINT, ""))
                    .libId(libIdOf(symbol))
                    .build();
            components.add(component);

            String suggestion = footprintSuggester.suggest(ref);
            if (suggestions.putIfAbsent(ref, suggestion) != null) {
                log.warn("Duplicate reference designator {} at line {}", ref, symbol.getLine());
            }
            log.debug("Extracted component {} ({}) -> {}", ref, component.getLibId(), suggestion);
        }

        return ComponentExtraction.builder()
                .components(Collections.unmodifiableList(components))
                .footprintSuggestions(Collections.unmodifiableMap(suggestions))
                .symbolsVisited(visited)
                .symbolsFiltered(filtered)
                .build();
    }

    /**
     * Library id from an immediate {@code (lib_id "Lib:Part")} child; empty when absent.
     */
    static String libIdOf(SexprList symbol) {
        for (SexprList libId : TreeSearch.findChildren(LIB_ID, symbol)) {
            if (libId.size() >= 2) {
                return libId.atomText(1).orElse("");
            }
        }
        return "";
    }
}
