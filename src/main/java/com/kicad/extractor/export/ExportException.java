package com.kicad.extractor.export;

/**
 * The in-memory model is structurally invalid and cannot be exported.
 * Indicates a programming error, not bad input.
 */
public class ExportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
