package com.kicad.extractor.board;

import com.kicad.extractor.config.BoardConfig;
import com.kicad.extractor.export.ModelReader;
import com.kicad.extractor.inference.GeminiNetInferenceClient;
import com.kicad.extractor.inference.NetInferenceClient;
import com.kicad.extractor.inference.NetInferenceService;
import com.kicad.extractor.inference.NetResolution;
import com.kicad.extractor.model.ParsedSchematic;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a parsed schematic, resolves its nets through inference (with fallback to
 * the candidate nets) and hands everything to a {@link BoardGenerator}.
 */
@RequiredArgsConstructor
public class BoardGenerationService {
    private static final Logger log = LoggerFactory.getLogger(BoardGenerationService.class);

    private final ModelReader modelReader;
    private final NetInferenceService inferenceService;
    private final BoardGenerator generator;

    /**
     * Wires the collaborators described by {@code config}. Inference is skipped when it
     * is disabled or no API key is available.
     */
    public static BoardGenerationService from(BoardConfig config, FootprintChooser chooser) {
        NetInferenceClient client = null;
        if (!config.isInferenceEnabled()) {
            log.info("Net inference disabled");
        } else if (!config.getInference().hasApiKey()) {
            log.warn("No API key found, skipping net inference");
        } else {
            client = GeminiNetInferenceClient.create(config.getInference());
        }

        BoardGenerator generator = switch (config.getFormat()) {
            case TEXT -> new TextSummaryBoardGenerator(chooser);
            case KICAD_PCB -> new KicadPcbBoardGenerator(chooser);
        };
        return new BoardGenerationService(new ModelReader(), new NetInferenceService(client), generator);
    }

    public BoardResult generate(Path parsedSchematic, Path outputDir) throws IOException {
        ParsedSchematic schematic = modelReader.read(parsedSchematic);
        log.info("Components loaded: {} | Nets detected: {}",
                schematic.getComponents().size(), schematic.getNets().size());
        return generate(schematic, outputDir);
    }

    public BoardResult generate(ParsedSchematic schematic, Path outputDir) throws IOException {
        NetResolution nets = inferenceService.resolveNets(schematic);

        BoardRequest request = BoardRequest.builder()
                .components(schematic.getComponents())
                .nets(nets.getNets())
                .footprintSuggestions(schematic.getFootprintSuggestions())
                .outputDir(outputDir)
                .build();

        BoardResult result = generator.generate(request);
        return result.toBuilder()
                .inferenceUsed(nets.isInferred())
                .fallbackReason(nets.getFallbackReason())
                .build();
    }
}
