package com.kicad.extractor.cli;

import com.kicad.extractor.SchematicFixtures;
import com.kicad.extractor.board.BoardFormat;
import com.kicad.extractor.cli.model.ValidatedBoardOptions;
import com.kicad.extractor.config.BoardConfig;
import com.kicad.extractor.export.ModelExporter;
import com.kicad.extractor.extract.SchematicExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the board command with a controlled environment.
 */
class BoardCommandTest {

    @TempDir
    Path tempDir;

    private Path parsedSchematic() throws IOException {
        Path json = tempDir.resolve("timer_lab_parsed.json");
        new ModelExporter().write(new SchematicExtractor()
                .extract(SchematicFixtures.load(SchematicFixtures.TIMER_LAB))
                .getSchematic(), json);
        return json;
    }

    private static CommandLine commandLine(BoardCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Test
    void testTextBoardWithoutApiKey() throws IOException {
        Path json = parsedSchematic();
        Path outputDir = tempDir.resolve("outputs");

        int exitCode = commandLine(new BoardCommand(name -> null))
                .execute("-i", json.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isZero();
        String summary = Files.readString(outputDir.resolve("ai_generated_board.txt"), StandardCharsets.UTF_8);
        assertThat(summary).contains("  NET_U1_4: [U1:4]");
        assertThat(summary).contains("  U1 -> Package_SO:SOIC-8_3.9x4.9mm_P1.27mm");
    }

    @Test
    void testKicadBoardWithInferenceDisabled() throws IOException {
        Path json = parsedSchematic();

        int exitCode = commandLine(new BoardCommand(Map.of("GEMINI_API_KEY", "secret")::get))
                .execute("-i", json.toString(), "-o", tempDir.toString(), "--format", "kicad_pcb", "--no-inference");

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("ai_generated_board.kicad_pcb")).exists();
    }

    @Test
    void testInvalidOptionsFail() throws IOException {
        Path json = parsedSchematic();
        Path notADirectory = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertThat(commandLine(new BoardCommand(name -> null))
                .execute("-i", tempDir.resolve("missing.json").toString())).isEqualTo(1);
        assertThat(commandLine(new BoardCommand(name -> null))
                .execute("-i", json.toString(), "-o", notADirectory.toString())).isEqualTo(1);
        assertThat(commandLine(new BoardCommand(name -> null))
                .execute("-i", json.toString(), "--inference-timeout-s", "0")).isEqualTo(1);
        assertThat(commandLine(new BoardCommand(name -> null))
                .execute("-i", json.toString(), "--inference-endpoint", "ftp://example")).isEqualTo(1);
    }

    @Test
    void testNonObjectModelFails() throws IOException {
        Path json = Files.writeString(tempDir.resolve("list.json"), "[]");

        assertThat(commandLine(new BoardCommand(name -> null))
                .execute("-i", json.toString(), "-o", tempDir.toString())).isEqualTo(1);
    }

    @Test
    void testConfigCarriesApiKeyFromEnvironment() throws IOException {
        Path json = parsedSchematic();
        BoardCommand command = new BoardCommand(Map.of("GEMINI_API_KEY", "secret")::get);
        commandLine(command).parseArgs("-i", json.toString(), "--format", "KICAD_PCB", "--inference-timeout-s", "15");

        BoardConfig config = command.toConfig(new ValidatedBoardOptions(json, tempDir));

        assertThat(config.getFormat()).isEqualTo(BoardFormat.KICAD_PCB);
        assertThat(config.isInferenceEnabled()).isTrue();
        assertThat(config.getInference().getApiKey()).isEqualTo("secret");
        assertThat(config.getInference().getTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.getInference().toString()).doesNotContain("secret");
    }
}
