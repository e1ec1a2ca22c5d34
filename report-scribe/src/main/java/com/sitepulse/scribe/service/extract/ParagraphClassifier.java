package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.config.ScribeProperties;
import com.sitepulse.scribe.model.FieldExtraction;
import com.sitepulse.scribe.model.Issue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sorts blank-line separated paragraphs into completed / issue / safety buckets
 * by keyword substring. A paragraph may land in more than one bucket.
 *
 * Keyword sets come from {@link ScribeProperties.Classifier}; English only.
 */
@Component
@RequiredArgsConstructor
public class ParagraphClassifier {

    static final double FOUND = 0.6;
    static final double MISSING = 0.2;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private final ScribeProperties properties;

    public record Classification(
            FieldExtraction<List<String>> completedTasks,
            FieldExtraction<List<Issue>> issues,
            FieldExtraction<List<String>> safetyObservations) {
    }

    public Classification classify(String text) {
        ScribeProperties.Classifier keywords = properties.getClassifier();
        int maxItems = properties.getExtraction().getMaxItems();

        List<String> completed = new ArrayList<>();
        List<Issue> issues = new ArrayList<>();
        List<String> safety = new ArrayList<>();

        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String lower = paragraph.toLowerCase(Locale.ROOT);
            String summary = paragraph.trim();

            if (completed.size() < maxItems && containsAny(lower, keywords.getCompletedKeywords())) {
                completed.add(summary);
            }
            if (issues.size() < maxItems && containsAny(lower, keywords.getIssueKeywords())) {
                String type = lower.contains(keywords.getDelayKeyword()) ? Issue.DELAY : Issue.ISSUE;
                issues.add(new Issue(type, summary));
            }
            if (safety.size() < maxItems && containsAny(lower, keywords.getSafetyKeywords())) {
                safety.add(summary);
            }
        }

        return new Classification(
                bucket(completed),
                bucket(issues),
                bucket(safety));
    }

    private static <T> FieldExtraction<List<T>> bucket(List<T> items) {
        return FieldExtraction.of(List.copyOf(items), items.isEmpty() ? MISSING : FOUND);
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) return true;
        }
        return false;
    }
}
