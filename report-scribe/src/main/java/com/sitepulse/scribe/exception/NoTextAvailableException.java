package com.sitepulse.scribe.exception;

/**
 * No input path produced usable text. Nothing is extracted or exported.
 */
public class NoTextAvailableException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "Provide a document or raw text";

    public NoTextAvailableException() {
        super(DEFAULT_MESSAGE);
    }

    public NoTextAvailableException(String message) {
        super(message);
    }
}
