package com.sitepulse.scribe.service.extract;

import com.sitepulse.scribe.model.FieldExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first report date written as YYYY-M-D or D-M-YYYY ('-' or '/' separators).
 *
 * Only years 2000-2099 are recognised. A match that is not a real calendar date
 * (e.g. 2024-02-30) is kept verbatim at the same confidence.
 */
@Component
@Slf4j
public class DateFieldExtractor {

    static final double FOUND = 0.9;
    static final double MISSING = 0.2;

    private static final String MONTH = "(0?[1-9]|1[0-2])";
    private static final String DAY = "(0?[1-9]|[12]\\d|3[01])";

    // Groups: 2-4 year-first (y, m, d), 5-7 day-first (d, m, y)
    private static final Pattern DATE_PATTERN = Pattern.compile(
            "\\b((20\\d{2})[-/]" + MONTH + "[-/]" + DAY
                    + "|" + DAY + "[-/]" + MONTH + "[-/](20\\d{2}))\\b");

    public FieldExtraction<String> extract(String text) {
        Matcher m = DATE_PATTERN.matcher(text);
        if (!m.find()) {
            return FieldExtraction.absent(MISSING);
        }

        String raw = m.group(1);
        try {
            LocalDate date = m.group(2) != null
                    ? LocalDate.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)))
                    : LocalDate.of(Integer.parseInt(m.group(7)), Integer.parseInt(m.group(6)), Integer.parseInt(m.group(5)));
            return FieldExtraction.of(date.toString(), FOUND);
        } catch (DateTimeException e) {
            log.debug("Date '{}' is not a valid calendar date, keeping raw text", raw);
            return FieldExtraction.of(raw, FOUND);
        }
    }
}
