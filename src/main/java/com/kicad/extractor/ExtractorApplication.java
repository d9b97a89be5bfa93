package com.kicad.extractor;

import com.kicad.extractor.cli.SchematicToolCommand;
import picocli.CommandLine;

/**
 * Main entry point for the KiCad Schematic Extractor.
 * This CLI tool turns a KiCad schematic into a JSON design model (components,
 * candidate nets, footprint suggestions) and generates board artifacts from it.
 */
public class ExtractorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new SchematicToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
