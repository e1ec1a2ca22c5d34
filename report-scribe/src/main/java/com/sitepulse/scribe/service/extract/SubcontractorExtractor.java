package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.config.ScribeProperties;
import com.sitepulse.scribe.model.FieldExtraction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Lines mentioning a contractor, kept when 3-80 characters long after trimming.
 */
@Component
@RequiredArgsConstructor
public class SubcontractorExtractor {

    static final double FOUND = 0.5;
    static final double MISSING = 0.2;

    private static final String KEYWORD = "contractor";
    private static final int MIN_LENGTH = 3;
    private static final int MAX_LENGTH = 80;

    private final ScribeProperties properties;

    public FieldExtraction<List<String>> extract(String text) {
        List<String> subs = text.lines()
                .filter(line -> line.toLowerCase(Locale.ROOT).contains(KEYWORD))
                .map(String::trim)
                .filter(line -> line.length() >= MIN_LENGTH && line.length() <= MAX_LENGTH)
                .limit(properties.getExtraction().getMaxItems())
                .toList();
        return FieldExtraction.of(subs, subs.isEmpty() ? MISSING : FOUND);
    }
}
