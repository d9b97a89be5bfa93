package com.kicad.extractor.board;

import com.kicad.extractor.model.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * Asks on the terminal which footprint to use for every component.
 * Pressing ENTER (or closing the input) accepts the suggestion.
 */
public class ConsoleFootprintChooser implements FootprintChooser {

    private final BufferedReader in;
    private final PrintStream out;
    private boolean introduced;

    public ConsoleFootprintChooser() {
        this(new InputStreamReader(System.in), System.out);
    }

    public ConsoleFootprintChooser(Reader in, PrintStream out) {
        this.in = in instanceof BufferedReader buffered ? buffered : new BufferedReader(in);
        this.out = out;
    }

    @Override
    public String choose(Component component, String suggested) {
        if (!introduced) {
            out.println("Enter a valid KiCad footprint (example: Resistor_SMD:R_0603)");
            out.println("Press ENTER to use the suggested footprint.");
            introduced = true;
        }

        String value = component.getValue().isEmpty() ? "N/A" : component.getValue();
        out.println();
        out.printf("What footprint do you want for %s (%s)?%n", component.getRef(), value);
        out.printf("→ [%s]: ", suggested);
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read footprint choice", e);
        }
        if (answer == null || answer.isBlank()) {
            return suggested;
        }
        return answer.trim();
    }
}
