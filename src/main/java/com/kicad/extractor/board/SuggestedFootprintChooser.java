package com.kicad.extractor.board;

import com.kicad.extractor.model.Component;

/**
 * Non-interactive chooser: always takes the suggestion.
 */
public class SuggestedFootprintChooser implements FootprintChooser {

    @Override
    public String choose(Component component, String suggested) {
        return suggested;
    }
}
