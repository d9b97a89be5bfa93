package com.kicad.extractor.cli.output;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level switch for the {@code --verbose} flag.
 */
public final class LogLevels {

    static final String ROOT_PACKAGE = "com.kicad.extractor";

    private LogLevels() {
        // Utility class
    }

    public static void enableDebug() {
        if (LoggerFactory.getLogger(ROOT_PACKAGE) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
