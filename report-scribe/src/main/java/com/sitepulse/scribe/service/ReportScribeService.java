package com.sitepulse.scribe.service;

import com.sitepulse.scribe.config.ScribeProperties;
import com.sitepulse.scribe.exception.ExportWriteException;
import com.sitepulse.scribe.exception.ExtractionFailedException;
import com.sitepulse.scribe.exception.NoTextAvailableException;
import com.sitepulse.scribe.model.ExtractionInput;
import com.sitepulse.scribe.model.ExtractionResult;
import com.sitepulse.scribe.model.ScribeRequest;
import com.sitepulse.scribe.output.SnapshotExporter;
import com.sitepulse.scribe.service.extract.ReportFieldExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates one extraction request: acquire text, extract and score fields,
 * write the CSV snapshot, attach its locator.
 *
 * Acquisition and export failures end the request. With
 * {@code scribe.export.fail-on-error=false} an export failure is downgraded to a
 * warning and the result is returned without a locator.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportScribeService {

    private final TextAcquisitionService textAcquisitionService;
    private final ReportFieldExtractor reportFieldExtractor;
    private final SnapshotExporter snapshotExporter;
    private final ScribeProperties properties;

    public ExtractionResult extract(ScribeRequest request) {
        try {
            ExtractionInput input = textAcquisitionService.acquire(request);
            ExtractionResult result = reportFieldExtractor.extract(input.text());
            return attachExport(result);

        } catch (NoTextAvailableException | ExportWriteException e) {
            throw e;
        } catch (Exception e) {
            log.error("Extraction failed: {}", e.getMessage(), e);
            throw new ExtractionFailedException(e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ExtractionResult attachExport(ExtractionResult result) {
        try {
            String locator = snapshotExporter.export(result);
            return result.withExportCsvUrl(locator);
        } catch (ExportWriteException e) {
            if (properties.getExport().isFailOnError()) {
                throw e;
            }
            log.warn("Snapshot export failed, returning result without export_csv_url: {}", e.getMessage());
            return result;
        }
    }
}
