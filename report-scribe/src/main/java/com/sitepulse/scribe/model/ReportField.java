package com.sitepulse.scribe.model;

/**
 * The extractable report fields, in snapshot row order.
 */
public enum ReportField {

    DATE("date"),
    PERSONNEL_COUNT("personnel_count"),
    SUBCONTRACTORS("subcontractors"),
    COMPLETED_TASKS("completed_tasks"),
    ISSUES("issues"),
    SAFETY_OBSERVATIONS("safety_observations");

    private final String key;

    ReportField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
