package com.sitepulse.scribe.service.document;

import com.sitepulse.scribe.service.BlankText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the document strategies in priority order and returns the first non-blank text.
 *
 * Strategies are injected in {@code @Order} sequence. Later strategies are never
 * consulted once an earlier one produces text.
 */
@Service
@Slf4j
public class DocumentTextExtractor {

    private final List<DocumentTextStrategy> strategies;

    public DocumentTextExtractor(List<DocumentTextStrategy> strategies) {
        if (strategies.size() < 2) {
            throw new IllegalStateException("At least two document text strategies are required, found "
                    + strategies.size());
        }
        this.strategies = List.copyOf(strategies);
        log.info("Document text strategies in priority order: {}",
                this.strategies.stream().map(DocumentTextStrategy::name).toList());
    }

    public Optional<String> extract(byte[] document) {
        if (document == null || document.length == 0) {
            log.debug("Empty document payload, skipping strategies");
            return Optional.empty();
        }

        for (DocumentTextStrategy strategy : strategies) {
            try {
                Optional<String> text = strategy.extract(document);
                if (text.isPresent() && BlankText.isNotBlank(text.get())) {
                    log.debug("Strategy {} produced {} chars", strategy.name(), text.get().length());
                    return text;
                }
                log.debug("Strategy {} produced no text", strategy.name());
            } catch (Exception e) {
                log.warn("Strategy {} failed on {} byte document: {}", strategy.name(), document.length, e.toString());
            }
        }

        log.info("No strategy could extract text from {} byte document", document.length);
        return Optional.empty();
    }
}
