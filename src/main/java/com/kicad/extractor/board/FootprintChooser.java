package com.kicad.extractor.board;

import com.kicad.extractor.model.Component;

/**
 * Decides the footprint placed for a component.
 */
public interface FootprintChooser {

    /**
     * @param component component being placed
     * @param suggested suggested footprint identifier, never {@code null}
     * @return footprint identifier to use; blank skips the component
     */
    String choose(Component component, String suggested);
}
