package com.sitepulse.scribe.exception;

/**
 * Wraps an unexpected fault raised while running the pipeline.
 */
public class ExtractionFailedException extends RuntimeException {

    public ExtractionFailedException(Throwable cause) {
        super("Extraction failed: " + cause.getMessage(), cause);
    }
}
