package com.sitepulse.scribe.model;

/**
 * A paragraph flagged as a site problem.
 *
 * @param type    "delay" or "issue"
 * @param summary the originating paragraph, trimmed
 */
public record Issue(String type, String summary) {

    public static final String DELAY = "delay";
    public static final String ISSUE = "issue";
}
