package com.kicad.extractor.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kicad.extractor.cli.model.ExtractOptions;
import com.kicad.extractor.cli.model.ValidatedExtractOptions;
import com.kicad.extractor.extract.ExtractionResult;
import com.kicad.extractor.model.ParsedSchematic;

/**
 * Responsible only for printing CLI output for the "extract" command.
 * No validation, no execution.
 */
public class ExtractResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExtractResultsPrinter.class);

    public void printBanner(ExtractOptions o, ValidatedExtractOptions v) {
        log.info("=================================================");
        log.info("KiCad Schematic Extractor");
        log.info("=================================================");
        log.info("Schematic: {}", v.getInputPath());
        log.info("Output File: {}", v.getOutputPath());
        log.info("Property Scope: {}", o.getPropertyScope());
        log.info("Global Labels: {}", o.isIncludeGlobalLabels() ? "included" : "ignored");
        log.info("=================================================");
    }

    public void printSuccess(ValidatedExtractOptions v, ExtractionResult result) {
        ParsedSchematic schematic = result.getSchematic();

        log.info("");
        log.info("=================================================");
        log.info("EXTRACTION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getOutputPath());
        log.info("Symbols Visited: {}", result.getSymbolsVisited());
        log.info("  Filtered (no placed reference): {}", result.getSymbolsFiltered());
        log.info("Components: {}", schematic.getComponents().size());
        log.info("Nets: {}", schematic.getNets().size());
        log.info("  Label Nets: {}", result.getLabelNets());
        log.info("  Pin Nets: {}", result.getPinNets());
        log.info("Footprint Suggestions: {}", schematic.getFootprintSuggestions().size());
        log.info("=================================================");
    }
}
