package com.sitepulse.scribe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.scribe.exception.NoTextAvailableException;
import com.sitepulse.scribe.model.ExtractionInput;
import com.sitepulse.scribe.model.ExtractionInput.TextSource;
import com.sitepulse.scribe.model.ScribeRequest;
import com.sitepulse.scribe.service.document.DocumentTextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.sitepulse.scribe.service.BlankText.isNotBlank;

/**
 * Resolves a request to a single block of report text.
 *
 * Priority: uploaded document, form "text" field, JSON body, plain-text body.
 * A document takes exclusive priority: if none of its strategies yield text
 * the request fails instead of falling back to the other inputs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TextAcquisitionService {

    static final List<String> JSON_TEXT_KEYS = List.of("text", "content", "raw_text");

    private final DocumentTextExtractor documentTextExtractor;
    private final ObjectMapper objectMapper;

    public ExtractionInput acquire(ScribeRequest request) {
        if (request.hasDocument()) {
            String text = documentTextExtractor.extract(request.getDocument())
                    .orElseThrow(() -> {
                        log.info("Document {} yielded no text", request.getDocumentName());
                        return new NoTextAvailableException();
                    });
            return accepted(text, TextSource.DOCUMENT);
        }

        if (isNotBlank(request.getFormText())) {
            return accepted(request.getFormText(), TextSource.FORM_FIELD);
        }

        String contentType = request.getContentType() == null
                ? ""
                : request.getContentType().toLowerCase(Locale.ROOT);

        if (contentType.contains("application/json")) {
            Optional<String> fromJson = fromJson(request.getBody());
            if (fromJson.isPresent()) {
                return accepted(fromJson.get(), TextSource.JSON_BODY);
            }
        } else if (contentType.startsWith("text/plain")) {
            Optional<String> fromPlain = fromPlainText(request.getBody());
            if (fromPlain.isPresent()) {
                return accepted(fromPlain.get(), TextSource.PLAIN_TEXT);
            }
        }

        throw new NoTextAvailableException();
    }

    // ── Paths ────────────────────────────────────────────────────────────────

    private Optional<String> fromJson(byte[] body) {
        if (body == null || body.length == 0) return Optional.empty();

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Request body is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Could not read JSON body: {}", e.getMessage());
            return Optional.empty();
        }

        if (payload == null) return Optional.empty();

        if (payload.isObject()) {
            for (String key : JSON_TEXT_KEYS) {
                JsonNode value = payload.get(key);
                if (value != null && value.isTextual() && isNotBlank(value.asText())) {
                    return Optional.of(value.asText());
                }
            }
            return Optional.empty();
        }

        if (payload.isTextual() && isNotBlank(payload.asText())) {
            return Optional.of(payload.asText());
        }
        return Optional.empty();
    }

    /**
     * Malformed UTF-8 sequences become U+FFFD instead of failing the decode.
     */
    private Optional<String> fromPlainText(byte[] body) {
        if (body == null || body.length == 0) return Optional.empty();
        String candidate = new String(body, StandardCharsets.UTF_8);
        return isNotBlank(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private ExtractionInput accepted(String text, TextSource source) {
        log.info("Acquired {} chars of report text from {}", text.length(), source);
        return new ExtractionInput(text, source);
    }
}
