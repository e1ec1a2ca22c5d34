package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.model.FieldExtraction;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First standalone integer of 1-5 digits in the text.
 *
 * This is a first-number heuristic: a leading date or reference number will be
 * picked up as the head count. The 0.6 confidence reflects that.
 */
@Component
public class PersonnelCountExtractor {

    static final double FOUND = 0.6;
    static final double MISSING = 0.2;

    private static final Pattern INTEGER_TOKEN = Pattern.compile("\\b(\\d{1,5})\\b");

    public FieldExtraction<Integer> extract(String text) {
        Matcher m = INTEGER_TOKEN.matcher(text);
        if (!m.find()) {
            return FieldExtraction.absent(MISSING);
        }
        try {
            return FieldExtraction.of(Integer.parseInt(m.group(1)), FOUND);
        } catch (NumberFormatException e) {
            return FieldExtraction.absent(MISSING);
        }
    }
}
