package com.kicad.extractor.cli.validation;

import com.kicad.extractor.cli.exception.OptionsValidationException;
import com.kicad.extractor.cli.model.ExtractOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExtractOptionsValidatorTest {

    @Test
    void testDefaultOutputUsesStem() {
        Path input = Path.of("/work/Lab4.kicad_sch");

        assertThat(ExtractOptionsValidator.resolveOutput(input, null))
                .isEqualTo(Path.of("/work/Lab4_parsed.json"));
    }

    @Test
    void testExplicitOutputWins() {
        Path output = ExtractOptionsValidator.resolveOutput(Path.of("/work/Lab4.kicad_sch"), Path.of("/tmp/out.json"));

        assertThat(output).isEqualTo(Path.of("/tmp/out.json"));
    }

    @Test
    void testNoInputNoOutput() {
        assertThat(ExtractOptionsValidator.resolveOutput(null, null)).isNull();
    }

    @Test
    void testCollectsAllErrorsForCommand(@TempDir Path dir) throws IOException {
        Path existing = Files.writeString(dir.resolve("taken.json"), "{}");
        ExtractOptions options = parse("-i", dir.resolve("missing.kicad_sch").toString(), "-o", existing.toString());

        assertThatThrownBy(() -> new ExtractOptionsValidator().validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> {
                    assertThat(e.getCommand()).isEqualTo("extract");
                    assertThat(e.getErrors()).hasSize(2);
                    assertThat(e.getMessage()).startsWith("Invalid options for 'extract'");
                });
    }

    @Test
    void testForceAllowsExistingOutput(@TempDir Path dir) throws IOException {
        Path input = Files.writeString(dir.resolve("lab.kicad_sch"), "(kicad_sch)");
        Files.writeString(dir.resolve("lab_parsed.json"), "{}");

        ExtractOptions options = parse("-i", input.toString(), "--force");

        assertThat(new ExtractOptionsValidator().validate(options).getOutputPath())
                .isEqualTo(dir.resolve("lab_parsed.json").toAbsolutePath().normalize());
    }

    private static ExtractOptions parse(String... args) {
        ExtractOptions options = new ExtractOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
