package com.sitepulse.scribe.model;

/**
 * Text acquired for one request, tagged with the path that produced it.
 */
public record ExtractionInput(String text, TextSource source) {

    public enum TextSource {
        DOCUMENT, FORM_FIELD, JSON_BODY, PLAIN_TEXT
    }
}
