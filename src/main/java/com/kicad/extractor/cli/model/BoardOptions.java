package com.kicad.extractor.cli.model;

import com.kicad.extractor.board.BoardFormat;
import com.kicad.extractor.config.InferenceConfig;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "board" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class BoardOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Parsed schematic JSON written by 'extract'")
	private Path input;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "outputs", description = "Directory for the board artifact")
	private Path outputDir;

	@Option(names = { "--format" }, defaultValue = "TEXT", description = "Board artifact: TEXT or KICAD_PCB")
	private BoardFormat format;

	@Option(names = { "--interactive" }, description = "Prompt for the footprint of every component")
	private boolean interactive;

	@Option(names = { "--no-inference" }, description = "Use the candidate nets without asking the inference backend")
	private boolean noInference;

	@Option(names = {
			"--inference-model" }, defaultValue = InferenceConfig.DEFAULT_MODEL, description = "Gemini model used for net inference")
	private String inferenceModel;

	@Option(names = {
			"--inference-endpoint" }, defaultValue = InferenceConfig.DEFAULT_ENDPOINT, description = "Base URL of the Gemini API")
	private String inferenceEndpoint;

	@Option(names = {
			"--inference-timeout-s" }, defaultValue = "60", description = "Net inference timeout in seconds")
	private int inferenceTimeoutSeconds;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

}
