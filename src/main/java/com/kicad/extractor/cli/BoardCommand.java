package com.kicad.extractor.cli;

import com.kicad.extractor.board.BoardGenerationService;
import com.kicad.extractor.board.BoardResult;
import com.kicad.extractor.board.ConsoleFootprintChooser;
import com.kicad.extractor.board.FootprintChooser;
import com.kicad.extractor.board.SuggestedFootprintChooser;
import com.kicad.extractor.cli.exception.OptionsValidationException;
import com.kicad.extractor.cli.model.BoardOptions;
import com.kicad.extractor.cli.model.ValidatedBoardOptions;
import com.kicad.extractor.cli.output.BoardResultsPrinter;
import com.kicad.extractor.cli.output.LogLevels;
import com.kicad.extractor.cli.validation.BoardOptionsValidator;
import com.kicad.extractor.config.BoardConfig;
import com.kicad.extractor.config.InferenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI command that builds a board artifact from a parsed schematic JSON file.
 */
@Command(
        name = "board",
        mixinStandardHelpOptions = true,
        version = "kicad-schematic-extractor 1.0.0",
        description = "Generates a board summary or a KiCad PCB file from a parsed schematic."
)
public class BoardCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BoardCommand.class);

    @Mixin
    private BoardOptions options = new BoardOptions();

    private final Function<String, String> environment;
    private final BoardOptionsValidator validator = new BoardOptionsValidator();
    private final BoardResultsPrinter printer = new BoardResultsPrinter();

    public BoardCommand() {
        this(System::getenv);
    }

    BoardCommand(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            LogLevels.enableDebug();
        }
        try {
            ValidatedBoardOptions v = validator.validate(options);
            printer.printBanner(options, v);

            BoardConfig config = toConfig(v);
            FootprintChooser chooser = config.isInteractive()
                    ? new ConsoleFootprintChooser()
                    : new SuggestedFootprintChooser();

            BoardResult result = BoardGenerationService.from(config, chooser)
                    .generate(config.getInput(), config.getOutputDir());

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid options for '{}':", e.getCommand());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("Board generation failed: {}", e.getMessage());
            log.debug("I/O failure", e);
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid parsed schematic: {}", e.getMessage());
            return 1;
        }
    }

    BoardConfig toConfig(ValidatedBoardOptions v) {
        InferenceConfig inference = InferenceConfig.builder()
                .endpoint(options.getInferenceEndpoint())
                .model(options.getInferenceModel())
                .apiKey(environment.apply(InferenceConfig.API_KEY_ENV))
                .timeout(Duration.ofSeconds(options.getInferenceTimeoutSeconds()))
                .build();

        return BoardConfig.builder()
                .input(v.getInputPath())
                .outputDir(v.getNormalizedOutputDir())
                .format(options.getFormat())
                .interactive(options.isInteractive())
                .inferenceEnabled(!options.isNoInference())
                .inference(inference)
                .build();
    }
}
