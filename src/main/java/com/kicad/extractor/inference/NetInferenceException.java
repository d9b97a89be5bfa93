package com.kicad.extractor.inference;

/**
 * The net inference backend failed or answered with something unusable.
 */
public class NetInferenceException extends Exception {

    private static final long serialVersionUID = 1L;

    public NetInferenceException(String message) {
        super(message);
    }

    public NetInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
