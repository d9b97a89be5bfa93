package com.kicad.extractor.extract;

import com.kicad.extractor.sexpr.SexprList;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code (property "Key" "Value" ...)} entries of a symbol into a map.
 */
@Getter
@RequiredArgsConstructor
public class PropertyResolver {

    public static final String REFERENCE = "Reference";
    public static final String VALUE = "Value";
    public static final String FOOTPRINT = "Footprint";

    private static final String PROPERTY = "property";

    private final PropertyScope scope;

    public PropertyResolver() {
        this(PropertyScope.RECURSIVE);
    }

    /**
     * Resolve all properties of {@code symbol}. Entries shorter than three elements
     * or whose key or value is not an atom are ignored. The first value seen for a
     * key is kept.
     */
    public Map<String, String> propertiesOf(SexprList symbol) {
        List<SexprList> properties = scope == PropertyScope.DIRECT
                ? TreeSearch.findChildren(PROPERTY, symbol)
                : TreeSearch.findAll(PROPERTY, symbol);

        Map<String, String> resolved = new LinkedHashMap<>();
        for (SexprList property : properties) {
            if (property.size() < 3) {
                continue;
            }
            Optional<String> key = property.atomText(1);
            Optional<String> value = property.atomText(2);
            if (key.isPresent() && value.isPresent()) {
                resolved.putIfAbsent(key.get(), value.get());
            }
        }
        return Collections.unmodifiableMap(resolved);
    }
}
