package com.sitepulse.scribe.output;

import com.opencsv.CSVWriter;
import com.sitepulse.scribe.config.ScribeProperties;
import com.sitepulse.scribe.exception.ExportWriteException;
import com.sitepulse.scribe.model.ExtractionResult;
import com.sitepulse.scribe.model.Issue;
import com.sitepulse.scribe.model.ReportField;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Writes an extraction result to a two-column CSV snapshot.
 *
 * Output path pattern: {outputDir}/{id}.csv where id is a random 32-char hex token,
 * e.g. exports/scribe/3f2b...9c.csv, served back at {urlPrefix}/{id}.csv.
 *
 * Layout (fields quoted only when they contain a separator, quote or line break):
 *   field,value
 *   date,2024-03-15
 *   personnel_count,42
 *   subcontractors,A Contractor; B Contractor
 *   completed_tasks,para one | para two
 *   issues,para three
 *   safety_observations,
 *
 * Files are created with CREATE_NEW, so an existing snapshot is never overwritten.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotExporter {

    public static final String[] HEADERS = {"field", "value"};

    static final String SUBCONTRACTOR_SEPARATOR = "; ";
    static final String LIST_SEPARATOR = " | ";

    private static final Pattern EXPORT_ID = Pattern.compile("[0-9a-f]{32}");

    private final ScribeProperties properties;

    @PostConstruct
    public void prepareOutputDirectory() {
        try {
            Files.createDirectories(outputDir());
            log.info("Snapshot exports will be written to {}", outputDir().toAbsolutePath());
        } catch (IOException e) {
            log.warn("Could not create export directory {} at startup, will retry on first export: {}",
                    outputDir(), e.getMessage());
        }
    }

    /**
     * @return the locator of the written snapshot, e.g. /exports/scribe/{id}.csv
     * @throws ExportWriteException if the directory or file cannot be written
     */
    public String export(ExtractionResult result) {
        Path dir = outputDir();
        String exportId = newExportId();
        Path outputPath = dir.resolve(exportId + ".csv");

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ExportWriteException("Cannot create export directory: " + dir, dir, e);
        }

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS, false);
            for (ReportField field : ReportField.values()) {
                writer.writeNext(new String[]{field.key(), flatten(field, result)}, false);
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("CSV writer reported an error");
            }

        } catch (IOException e) {
            log.error("Failed to write snapshot {}: {}", outputPath, e.getMessage(), e);
            throw new ExportWriteException("CSV snapshot write failed", outputPath, e);
        }

        log.info("Written extraction snapshot {}", outputPath);
        return locatorFor(exportId);
    }

    /**
     * Resolve a previously written snapshot. Ids that are not export tokens never reach the filesystem.
     */
    public Optional<Path> find(String exportId) {
        if (exportId == null || !EXPORT_ID.matcher(exportId).matches()) {
            throw new IllegalArgumentException("Invalid export id: " + exportId);
        }
        Path path = outputDir().resolve(exportId + ".csv");
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String flatten(ReportField field, ExtractionResult r) {
        return switch (field) {
            case DATE -> str(r.getDate());
            case PERSONNEL_COUNT -> str(r.getPersonnelCount());
            case SUBCONTRACTORS -> join(r.getSubcontractors(), SUBCONTRACTOR_SEPARATOR);
            case COMPLETED_TASKS -> join(r.getCompletedTasks(), LIST_SEPARATOR);
            case ISSUES -> r.getIssues() == null ? "" : join(r.getIssues().stream().map(Issue::summary).toList(), LIST_SEPARATOR);
            case SAFETY_OBSERVATIONS -> join(r.getSafetyObservations(), LIST_SEPARATOR);
        };
    }

    private String locatorFor(String exportId) {
        String prefix = properties.getExport().getUrlPrefix();
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + "/" + exportId + ".csv";
    }

    private Path outputDir() {
        return Paths.get(properties.getExport().getOutputDir());
    }

    private static String newExportId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String join(List<String> values, String separator) {
        return values == null ? "" : String.join(separator, values);
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
