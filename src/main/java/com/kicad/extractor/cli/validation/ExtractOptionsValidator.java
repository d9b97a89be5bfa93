package com.kicad.extractor.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kicad.extractor.cli.exception.OptionsValidationException;
import com.kicad.extractor.cli.model.ExtractOptions;
import com.kicad.extractor.cli.model.ValidatedExtractOptions;
import com.kicad.extractor.util.FileWriteUtil;

public class ExtractOptionsValidator {

	static final String OUTPUT_SUFFIX = "_parsed.json";

	public ValidatedExtractOptions validate(ExtractOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = o.getInput();
		if (input == null) {
			errors.add("Schematic file is required (--input / -i).");
		} else if (!Files.isRegularFile(input)) {
			errors.add("Schematic file does not exist or is not a file: " + input);
		}

		Path output = resolveOutput(input, o.getOutput());
		if (output != null) {
			if (Files.isDirectory(output)) {
				errors.add("Output path is a directory: " + output);
			} else if (Files.exists(output) && !o.isForce()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("extract", errors);
		}

		return new ValidatedExtractOptions(input.toAbsolutePath().normalize(), output);
	}

	/**
	 * Explicit output, or {@code <stem>_parsed.json} beside the schematic.
	 */
	static Path resolveOutput(Path input, Path explicitOutput) {
		if (explicitOutput != null) {
			return explicitOutput.toAbsolutePath().normalize();
		}
		if (input == null) {
			return null;
		}
		Path absoluteInput = input.toAbsolutePath().normalize();
		return absoluteInput.resolveSibling(FileWriteUtil.stem(absoluteInput) + OUTPUT_SUFFIX);
	}
}
