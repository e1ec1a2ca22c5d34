package com.sitepulse.scribe.model;

/**
 * Output of a single field extractor: the value (null when absent) and how far it is trusted.
 */
public record FieldExtraction<T>(T value, double confidence) {

    public static <T> FieldExtraction<T> of(T value, double confidence) {
        return new FieldExtraction<>(value, confidence);
    }

    public static <T> FieldExtraction<T> absent(double confidence) {
        return new FieldExtraction<>(null, confidence);
    }
}
