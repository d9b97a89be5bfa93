package com.kicad.extractor.board;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of a board generation run.
 */
@Value
@Builder(toBuilder = true)
public class BoardResult {
    Path artifact;
    BoardFormat format;

    int componentsPlaced;
    int componentsSkipped;
    int netsWritten;

    boolean inferenceUsed;
    String fallbackReason;
}
