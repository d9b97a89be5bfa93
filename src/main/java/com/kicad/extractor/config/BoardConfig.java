package com.kicad.extractor.config;

import com.kicad.extractor.board.BoardFormat;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Settings for one board generation run.
 */
@Value
@Builder(toBuilder = true)
public class BoardConfig {

    /**
     * Parsed schematic JSON produced by the extract command.
     */
    @NonNull
    Path input;

    @NonNull
    Path outputDir;

    @NonNull
    @Builder.Default
    BoardFormat format = BoardFormat.TEXT;

    /**
     * Prompt for every footprint instead of taking the suggestion.
     */
    boolean interactive;

    /**
     * Ask the inference backend for nets; when off the candidate nets are used as-is.
     */
    @Builder.Default
    boolean inferenceEnabled = true;

    @NonNull
    @Builder.Default
    InferenceConfig inference = InferenceConfig.builder().build();
}
