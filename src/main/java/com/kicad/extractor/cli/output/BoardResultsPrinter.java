package com.kicad.extractor.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kicad.extractor.board.BoardResult;
import com.kicad.extractor.cli.model.BoardOptions;
import com.kicad.extractor.cli.model.ValidatedBoardOptions;

/**
 * Responsible only for printing CLI output for the "board" command.
 */
public class BoardResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BoardResultsPrinter.class);

    public void printBanner(BoardOptions o, ValidatedBoardOptions v) {
        log.info("=================================================");
        log.info("KiCad Board Generator");
        log.info("=================================================");
        log.info("Parsed Schematic: {}", v.getInputPath());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Format: {}", o.getFormat());
        log.info("Interactive: {}", o.isInteractive());
        if (o.isNoInference()) {
            log.info("Net Inference: disabled");
        } else {
            log.info("Net Inference: {} ({}s timeout)", o.getInferenceModel(), o.getInferenceTimeoutSeconds());
        }
        log.info("=================================================");
    }

    public void printSuccess(BoardResult result) {
        log.info("");
        log.info("=================================================");
        log.info("BOARD GENERATED");
        log.info("=================================================");
        log.info("Artifact: {}", result.getArtifact());
        log.info("Components Placed: {}", result.getComponentsPlaced());
        if (result.getComponentsSkipped() > 0) {
            log.info("Components Skipped: {}", result.getComponentsSkipped());
        }
        log.info("Nets Written: {}", result.getNetsWritten());
        if (result.isInferenceUsed()) {
            log.info("Net Source: inferred");
        } else {
            log.info("Net Source: candidate nets ({})", result.getFallbackReason());
        }
        log.info("=================================================");
    }
}
