package com.kicad.extractor.board;

import com.kicad.extractor.extract.FootprintSuggester;
import com.kicad.extractor.model.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the footprint of every component of a request through a {@link FootprintChooser}.
 */
public class FootprintAssignment {
    private static final Logger log = LoggerFactory.getLogger(FootprintAssignment.class);

    private final FootprintChooser chooser;

    public FootprintAssignment(FootprintChooser chooser) {
        this.chooser = chooser;
    }

    /**
     * @return reference to chosen footprint, in component order; components whose
     *         choice is blank are left out
     */
    public Map<String, String> assign(BoardRequest request) {
        Map<String, String> chosen = new LinkedHashMap<>();
        for (Component component : request.getComponents()) {
            String suggested = request.getFootprintSuggestions()
                    .getOrDefault(component.getRef(), FootprintSuggester.DEFAULT_FOOTPRINT);
            String footprint = chooser.choose(component, suggested);
            if (footprint == null || footprint.isBlank()) {
                log.warn("No footprint chosen for {}, skipping it", component.getRef());
                continue;
            }
            chosen.put(component.getRef(), footprint.trim());
        }
        return Collections.unmodifiableMap(chosen);
    }
}
