package com.sitepulse.scribe.config;

import com.sitepulse.scribe.model.ExtractionResult;
import com.sitepulse.scribe.model.ScribeRequest;
import com.sitepulse.scribe.output.SnapshotExporter;
import com.sitepulse.scribe.service.ReportScribeService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScribeController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ReportScribeService scribeService;
    private final SnapshotExporter snapshotExporter;

    // ── Extraction ────────────────────────────────────────────────────────────

    /**
     * Extract a structured site report.
     *
     * Accepts:
     *   multipart/form-data with a 'file' part (PDF)
     *   application/json {"text": "..."} (also "content" / "raw_text", or a bare JSON string)
     *   multipart/form-data or x-www-form-urlencoded with a 'text' field
     *   text/plain raw body
     */
    @PostMapping("/extract")
    public ResponseEntity<ExtractionResult> extract(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "text", required = false) String textForm,
            HttpServletRequest request) throws IOException {

        String contentType = request.getContentType();
        log.debug("POST /extract content-type={} file={}", contentType,
                file == null ? null : file.getOriginalFilename());

        ScribeRequest.ScribeRequestBuilder scribeRequest = ScribeRequest.builder()
                .formText(textForm)
                .contentType(contentType);

        if (file != null) {
            scribeRequest.document(file.getBytes()).documentName(file.getOriginalFilename());
        } else if (hasReadableBody(contentType)) {
            scribeRequest.body(request.getInputStream().readAllBytes());
        }

        return ResponseEntity.ok(scribeService.extract(scribeRequest.build()));
    }

    // ── Snapshot download ─────────────────────────────────────────────────────

    /**
     * GET /exports/scribe/{id}.csv
     */
    @GetMapping("${scribe.export.url-prefix:/exports/scribe}/{exportId}.csv")
    public ResponseEntity<Resource> download(@PathVariable String exportId) {
        return snapshotExporter.find(exportId)
                .<ResponseEntity<Resource>>map(path -> ResponseEntity.ok()
                        .contentType(TEXT_CSV)
                        .header(HttpHeaders.CONTENT_DISPOSITION,
                                "attachment; filename=\"" + path.getFileName() + "\"")
                        .body(new FileSystemResource(path)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    private boolean hasReadableBody(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return !ct.startsWith("multipart/") && !ct.startsWith("application/x-www-form-urlencoded");
    }
}
