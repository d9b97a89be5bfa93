package com.kicad.extractor.cli.model;

import com.kicad.extractor.extract.PropertyScope;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "extract" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExtractOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "KiCad schematic file (.kicad_sch)")
	private Path input;

	@Option(names = { "--output",
			"-o" }, description = "Output JSON file (defaults to <schematic name>_parsed.json next to the input)")
	private Path output;

	@Option(names = {
			"--property-scope" }, defaultValue = "RECURSIVE", description = "Property lookup scope: RECURSIVE (includes nested symbols) or DIRECT")
	private PropertyScope propertyScope;

	@Option(names = {
			"--include-global-labels" }, description = "Also create label nets from global and hierarchical labels")
	private boolean includeGlobalLabels;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

}
