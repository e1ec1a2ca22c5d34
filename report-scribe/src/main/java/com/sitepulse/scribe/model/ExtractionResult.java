package com.sitepulse.scribe.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * Structured site report produced by one extraction request.
 *
 * Immutable once assembled. Attaching the snapshot locator returns a copy
 * via {@link #withExportCsvUrl(String)}.
 */
@Value
@Builder
@JsonPropertyOrder({"date", "project", "location", "subcontractors", "personnel_count",
        "completed_tasks", "issues", "safety_observations", "low_confidence", "confidence",
        "export_csv_url"})
public class ExtractionResult {

    /** ISO-8601 date, or the raw matched text if it was not a valid calendar date */
    String date;

    /** Reserved for a future extractor, always null */
    String project;

    /** Reserved for a future extractor, always null */
    String location;

    List<String> subcontractors;

    @JsonProperty("personnel_count")
    Integer personnelCount;

    @JsonProperty("completed_tasks")
    List<String> completedTasks;

    List<Issue> issues;

    @JsonProperty("safety_observations")
    List<String> safetyObservations;

    @JsonProperty("low_confidence")
    boolean lowConfidence;

    /** Field key to confidence, one entry per {@link ReportField} in declaration order */
    Map<String, Double> confidence;

    @With
    @JsonProperty("export_csv_url")
    String exportCsvUrl;
}
