package com.kicad.extractor.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kicad.extractor.cli.exception.OptionsValidationException;
import com.kicad.extractor.cli.model.BoardOptions;
import com.kicad.extractor.cli.model.ValidatedBoardOptions;

public class BoardOptionsValidator {

	public ValidatedBoardOptions validate(BoardOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Parsed schematic is required (--input / -i).");
		} else if (!Files.isRegularFile(o.getInput())) {
			errors.add("Parsed schematic does not exist or is not a file: " + o.getInput());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of("outputs") : o.getOutputDir())
				.toAbsolutePath().normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (o.getFormat() == null) {
			errors.add("Board format is required (--format TEXT|KICAD_PCB).");
		}

		if (!o.isNoInference()) {
			if (isBlank(o.getInferenceModel())) {
				errors.add("Inference model must not be blank.");
			}
			if (isBlank(o.getInferenceEndpoint()) || !(o.getInferenceEndpoint().startsWith("http://")
					|| o.getInferenceEndpoint().startsWith("https://"))) {
				errors.add("Inference endpoint must be an http(s) URL. Got: " + o.getInferenceEndpoint());
			}
			if (o.getInferenceTimeoutSeconds() <= 0) {
				errors.add("Inference timeout must be > 0. Got: " + o.getInferenceTimeoutSeconds());
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("board", errors);
		}

		return new ValidatedBoardOptions(o.getInput().toAbsolutePath().normalize(), normalizedOutputDir);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
