package com.kicad.extractor.board;

import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Input of a {@link BoardGenerator}.
 */
@Value
@Builder
public class BoardRequest {
    @NonNull
    @Singular
    List<Component> components;

    @NonNull
    @Singular
    List<Net> nets;

    @NonNull
    @Singular
    Map<String, String> footprintSuggestions;

    @NonNull
    Path outputDir;
}
