package com.kicad.extractor.cli;

import com.kicad.extractor.cli.exception.OptionsValidationException;
import com.kicad.extractor.cli.model.ExtractOptions;
import com.kicad.extractor.cli.model.ValidatedExtractOptions;
import com.kicad.extractor.cli.output.ExtractResultsPrinter;
import com.kicad.extractor.cli.output.LogLevels;
import com.kicad.extractor.cli.validation.ExtractOptionsValidator;
import com.kicad.extractor.config.ExtractorConfig;
import com.kicad.extractor.export.ExportException;
import com.kicad.extractor.export.ModelExporter;
import com.kicad.extractor.extract.ExtractionResult;
import com.kicad.extractor.extract.SchematicExtractor;
import com.kicad.extractor.sexpr.GrammarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * CLI command that turns a KiCad schematic into the JSON design model.
 */
@Command(
        name = "extract",
        mixinStandardHelpOptions = true,
        version = "kicad-schematic-extractor 1.0.0",
        description = "Extracts components, candidate nets and footprint suggestions from a .kicad_sch file."
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    private ExtractOptions options = new ExtractOptions();

    private final ExtractOptionsValidator validator = new ExtractOptionsValidator();
    private final ExtractResultsPrinter printer = new ExtractResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            LogLevels.enableDebug();
        }
        try {
            ValidatedExtractOptions v = validator.validate(options);
            printer.printBanner(options, v);

            ExtractorConfig config = ExtractorConfig.builder()
                    .propertyScope(options.getPropertyScope())
                    .includeGlobalLabels(options.isIncludeGlobalLabels())
                    .build();

            ExtractionResult result = new SchematicExtractor(config).extract(v.getInputPath());
            new ModelExporter().write(result.getSchematic(), v.getOutputPath());

            printer.printSuccess(v, result);
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid options for '{}':", e.getCommand());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        } catch (GrammarException e) {
            log.error("Malformed schematic: {}", e.getMessage());
            return 1;
        } catch (ExportException e) {
            log.error("Refusing to write an invalid model: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Extraction failed: {}", e.getMessage());
            log.debug("I/O failure", e);
            return 1;
        }
    }
}
