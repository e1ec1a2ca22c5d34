package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.config.ScribeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Any single field at or below the threshold marks the whole report as low confidence.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceAggregator {

    private final ScribeProperties properties;

    public boolean isLowConfidence(Map<String, Double> confidence) {
        double threshold = properties.getExtraction().getLowConfidenceThreshold();
        return confidence.values().stream().anyMatch(c -> c <= threshold);
    }
}
