package com.raditha.smells;

/**
 * Base class for the fatal errors raised while parsing, analyzing, rewriting or
 * printing a source file.
 */
public class SmellDetectorException extends RuntimeException {

    public SmellDetectorException(String message) {
        super(message);
    }

    public SmellDetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
