package com.sitepulse.scribe.service;

import java.util.regex.Pattern;

/**
 * Blank check that also treats Unicode space separators (U+00A0, U+2007, U+202F, ...)
 * as whitespace. {@link String#isBlank()} does not.
 */
public final class BlankText {

    private static final Pattern BLANK = Pattern.compile("[\\s\\p{Z}]*", Pattern.UNICODE_CHARACTER_CLASS);

    private BlankText() {
    }

    public static boolean isBlank(String value) {
        return value == null || BLANK.matcher(value).matches();
    }

    public static boolean isNotBlank(String value) {
        return !isBlank(value);
    }
}
