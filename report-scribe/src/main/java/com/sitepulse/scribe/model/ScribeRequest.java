package com.sitepulse.scribe.model;

import lombok.Builder;
import lombok.Value;

/**
 * The raw shapes a request may carry. At most one is expected to be populated;
 * when several are, acquisition priority decides.
 */
@Value
@Builder
public class ScribeRequest {

    /** Uploaded document bytes, null when no file part was sent. Shared with the caller, not copied. */
    byte[] document;

    /** Original upload filename, for logging only */
    String documentName;

    /** The "text" form field */
    String formText;

    /** Declared Content-Type header, may be null */
    String contentType;

    /** Raw request body; only read for JSON and plain-text requests */
    byte[] body;

    public boolean hasDocument() {
        return document != null;
    }
}
