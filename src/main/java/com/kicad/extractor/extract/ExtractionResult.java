package com.kicad.extractor.extract;

import com.kicad.extractor.model.ParsedSchematic;
import lombok.Builder;
import lombok.Value;

/**
 * Result of an extraction run: the model plus counters for reporting.
 */
@Value
@Builder
public class ExtractionResult {
    ParsedSchematic schematic;

    int symbolsVisited;
    int symbolsFiltered;
    int labelNets;
    int pinNets;
}
