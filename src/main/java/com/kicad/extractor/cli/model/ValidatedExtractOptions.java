package com.kicad.extractor.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the extract command. Keeps ExtractCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExtractOptions {
    Path inputPath;
    Path outputPath;
}
