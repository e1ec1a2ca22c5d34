package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.model.ExtractionResult;
import com.sitepulse.scribe.model.FieldExtraction;
import com.sitepulse.scribe.model.Issue;
import com.sitepulse.scribe.model.ReportField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every field extractor over the acquired text and assembles the scored report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportFieldExtractor {

    private final DateFieldExtractor dateExtractor;
    private final PersonnelCountExtractor personnelCountExtractor;
    private final SubcontractorExtractor subcontractorExtractor;
    private final ParagraphClassifier paragraphClassifier;
    private final ConfidenceAggregator confidenceAggregator;

    public ExtractionResult extract(String text) {
        FieldExtraction<String> date = dateExtractor.extract(text);
        FieldExtraction<Integer> personnel = personnelCountExtractor.extract(text);
        FieldExtraction<List<String>> subcontractors = subcontractorExtractor.extract(text);
        ParagraphClassifier.Classification paragraphs = paragraphClassifier.classify(text);
        FieldExtraction<List<String>> completed = paragraphs.completedTasks();
        FieldExtraction<List<Issue>> issues = paragraphs.issues();
        FieldExtraction<List<String>> safety = paragraphs.safetyObservations();

        Map<String, Double> confidence = new LinkedHashMap<>();
        confidence.put(ReportField.DATE.key(), date.confidence());
        confidence.put(ReportField.PERSONNEL_COUNT.key(), personnel.confidence());
        confidence.put(ReportField.SUBCONTRACTORS.key(), subcontractors.confidence());
        confidence.put(ReportField.COMPLETED_TASKS.key(), completed.confidence());
        confidence.put(ReportField.ISSUES.key(), issues.confidence());
        confidence.put(ReportField.SAFETY_OBSERVATIONS.key(), safety.confidence());

        boolean lowConfidence = confidenceAggregator.isLowConfidence(confidence);
        log.debug("Field confidences {} (low={})", confidence, lowConfidence);

        return ExtractionResult.builder()
                .date(date.value())
                .subcontractors(subcontractors.value())
                .personnelCount(personnel.value())
                .completedTasks(completed.value())
                .issues(issues.value())
                .safetyObservations(safety.value())
                .lowConfidence(lowConfidence)
                .confidence(Collections.unmodifiableMap(confidence))
                .build();
    }
}
