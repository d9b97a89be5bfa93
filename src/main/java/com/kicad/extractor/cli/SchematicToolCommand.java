package com.kicad.extractor.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing on its own except print usage.
 */
@Command(
        name = "kicad-extract",
        mixinStandardHelpOptions = true,
        version = "kicad-schematic-extractor 1.0.0",
        description = "Extracts components, candidate nets and footprint hints from KiCad schematics.",
        subcommands = {ExtractCommand.class, BoardCommand.class}
)
public class SchematicToolCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
