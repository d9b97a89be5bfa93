package com.kicad.extractor.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the board command. Keeps BoardCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBoardOptions {
    Path inputPath;
    Path normalizedOutputDir;
}
