package com.kicad.extractor.board;

import com.kicad.extractor.config.BoardConfig;
import com.kicad.extractor.config.InferenceConfig;
import com.kicad.extractor.export.ModelExporter;
import com.kicad.extractor.export.ModelReader;
import com.kicad.extractor.inference.NetInferenceClient;
import com.kicad.extractor.inference.NetInferenceException;
import com.kicad.extractor.inference.NetInferenceService;
import com.kicad.extractor.model.Component;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import com.kicad.extractor.model.PinReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the board pipeline: read model, resolve nets, write artifact.
 */
class BoardGenerationServiceTest {

    @TempDir
    Path tempDir;

    private static final ParsedSchematic SCHEMATIC = ParsedSchematic.builder()
            .components(List.of(Component.builder().ref("U1").value("NE555P").libId("Timer:NE555P").build()))
            .nets(List.of(
                    Net.label("VDD", 1),
                    Net.pin("NET_U1_8", 2, PinReference.of("U1", "8"))))
            .footprintSuggestions(Map.of("U1", "Package_SO:SOIC-8_3.9x4.9mm_P1.27mm"))
            .build();

    private static NetInferenceClient answering(List<Net> nets) {
        return new NetInferenceClient() {
            @Override
            public List<Net> infer(ParsedSchematic schematic) {
                return nets;
            }

            @Override
            public String describe() {
                return "fixed answer";
            }
        };
    }

    private static NetInferenceClient failing() {
        return new NetInferenceClient() {
            @Override
            public List<Net> infer(ParsedSchematic schematic) throws NetInferenceException {
                throw new NetInferenceException("connection refused");
            }

            @Override
            public String describe() {
                return "unreachable";
            }
        };
    }

    @Test
    void testInferredNetsReachTheBoard() throws IOException {
        BoardGenerationService service = new BoardGenerationService(new ModelReader(),
                new NetInferenceService(answering(List.of(Net.builder().name("VCC").code(1)
                        .node(PinReference.of("U1", "8")).node(PinReference.of("U1", "4")).build()))),
                new TextSummaryBoardGenerator(new SuggestedFootprintChooser()));

        BoardResult result = service.generate(SCHEMATIC, tempDir);

        assertThat(result.isInferenceUsed()).isTrue();
        assertThat(result.getFallbackReason()).isNull();
        assertThat(result.getNetsWritten()).isEqualTo(1);
        assertThat(Files.readString(result.getArtifact(), StandardCharsets.UTF_8)).contains("  VCC: [U1:8, U1:4]");
    }

    @Test
    void testFailedInferenceFallsBackToCandidates() throws IOException {
        BoardGenerationService service = new BoardGenerationService(new ModelReader(),
                new NetInferenceService(failing()),
                new TextSummaryBoardGenerator(new SuggestedFootprintChooser()));

        BoardResult result = service.generate(SCHEMATIC, tempDir);

        assertThat(result.isInferenceUsed()).isFalse();
        assertThat(result.getFallbackReason()).isEqualTo("connection refused");
        assertThat(result.getNetsWritten()).isEqualTo(2);
        assertThat(Files.readString(result.getArtifact(), StandardCharsets.UTF_8))
                .contains("  VDD: []")
                .contains("  NET_U1_8: [U1:8]");
    }

    @Test
    void testReadsParsedSchematicFile() throws IOException {
        Path json = tempDir.resolve("timer_parsed.json");
        new ModelExporter().write(SCHEMATIC, json);
        BoardGenerationService service = new BoardGenerationService(new ModelReader(),
                new NetInferenceService(null),
                new KicadPcbBoardGenerator(new SuggestedFootprintChooser()));

        BoardResult result = service.generate(json, tempDir.resolve("outputs"));

        assertThat(result.getArtifact()).exists();
        assertThat(result.getFormat()).isEqualTo(BoardFormat.KICAD_PCB);
        assertThat(result.getComponentsPlaced()).isEqualTo(1);
    }

    @Test
    void testWithoutApiKeyInferenceIsSkipped() throws IOException {
        BoardConfig config = BoardConfig.builder()
                .input(tempDir.resolve("unused.json"))
                .outputDir(tempDir)
                .inference(InferenceConfig.builder().apiKey(" ").build())
                .build();

        BoardResult result = BoardGenerationService.from(config, new SuggestedFootprintChooser())
                .generate(SCHEMATIC, tempDir);

        assertThat(result.isInferenceUsed()).isFalse();
        assertThat(result.getFallbackReason()).contains("no inference backend");
        assertThat(result.getArtifact().getFileName().toString()).isEqualTo("ai_generated_board.txt");
    }

    @Test
    void testFormatSelectsGenerator() throws IOException {
        BoardConfig config = BoardConfig.builder()
                .input(tempDir.resolve("unused.json"))
                .outputDir(tempDir)
                .format(BoardFormat.KICAD_PCB)
                .inferenceEnabled(false)
                .build();

        BoardResult result = BoardGenerationService.from(config, new SuggestedFootprintChooser())
                .generate(SCHEMATIC, tempDir);

        assertThat(result.getFormat()).isEqualTo(BoardFormat.KICAD_PCB);
        assertThat(result.getArtifact().getFileName().toString()).isEqualTo("ai_generated_board.kicad_pcb");
    }
}
