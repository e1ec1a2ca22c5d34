package com.sitepulse.scribe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "scribe")
@Data
public class ScribeProperties {

    private Export export = new Export();
    private Extraction extraction = new Extraction();
    private Classifier classifier = new Classifier();

    @Data
    public static class Export {
        private String outputDir = "exports/scribe";
        private String urlPrefix = "/exports/scribe";

        /**
         * When true a failed snapshot write fails the whole request.
         * When false the result is returned without export_csv_url.
         */
        private boolean failOnError = true;
    }

    @Data
    public static class Extraction {
        private int maxItems = 5;
        private double lowConfidenceThreshold = 0.25;
    }

    /**
     * Keyword sets for paragraph bucketing. Matched as lowercase substrings.
     */
    @Data
    public static class Classifier {
        private List<String> completedKeywords = new ArrayList<>(List.of(
                "completed", "finished", "achieved", "done"));
        private List<String> issueKeywords = new ArrayList<>(List.of(
                "delay", "blocked", "issue", "problem", "shortage"));
        private List<String> safetyKeywords = new ArrayList<>(List.of(
                "safety", "ppe", "incident", "hazard", "near miss", "near-miss"));
        private String delayKeyword = "delay";
    }
}
