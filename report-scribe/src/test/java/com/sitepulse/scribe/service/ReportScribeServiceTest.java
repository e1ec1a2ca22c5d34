package com.sitepulse.scribe.service;

import com.sitepulse.scribe.config.ScribeProperties;
import com.sitepulse.scribe.exception.ExportWriteException;
import com.sitepulse.scribe.exception.ExtractionFailedException;
import com.sitepulse.scribe.exception.NoTextAvailableException;
import com.sitepulse.scribe.model.ExtractionInput;
import com.sitepulse.scribe.model.ExtractionInput.TextSource;
import com.sitepulse.scribe.model.ExtractionResult;
import com.sitepulse.scribe.model.ScribeRequest;
import com.sitepulse.scribe.output.SnapshotExporter;
import com.sitepulse.scribe.service.extract.ReportFieldExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportScribeServiceTest {

    private static final ScribeRequest REQUEST = ScribeRequest.builder().formText("Crew 4").build();

    @Mock
    private TextAcquisitionService textAcquisitionService;

    @Mock
    private ReportFieldExtractor reportFieldExtractor;

    @Mock
    private SnapshotExporter snapshotExporter;

    private ScribeProperties properties;
    private ReportScribeService service;

    @BeforeEach
    void setUp() {
        properties = new ScribeProperties();
        service = new ReportScribeService(textAcquisitionService, reportFieldExtractor, snapshotExporter, properties);
    }

    @Test
    void attachesExportLocatorToExtractedResult() {
        ExtractionResult extracted = result();
        when(textAcquisitionService.acquire(REQUEST)).thenReturn(new ExtractionInput("Crew 4", TextSource.FORM_FIELD));
        when(reportFieldExtractor.extract("Crew 4")).thenReturn(extracted);
        when(snapshotExporter.export(extracted)).thenReturn("/exports/scribe/abc.csv");

        ExtractionResult result = service.extract(REQUEST);

        assertThat(result.getExportCsvUrl()).isEqualTo("/exports/scribe/abc.csv");
        assertThat(result.getPersonnelCount()).isEqualTo(4);
        assertThat(extracted.getExportCsvUrl()).isNull();
    }

    @Test
    void noTextStopsBeforeExtractionAndExport() {
        when(textAcquisitionService.acquire(REQUEST)).thenThrow(new NoTextAvailableException());

        assertThatThrownBy(() -> service.extract(REQUEST)).isInstanceOf(NoTextAvailableException.class);
        verify(reportFieldExtractor, never()).extract(anyString());
        verify(snapshotExporter, never()).export(any());
    }

    @Test
    void exportFailureFailsRequestByDefault() {
        stubExtraction();
        when(snapshotExporter.export(any())).thenThrow(exportFailure());

        assertThatThrownBy(() -> service.extract(REQUEST)).isInstanceOf(ExportWriteException.class);
    }

    @Test
    void exportFailureIsSoftWhenConfigured() {
        properties.getExport().setFailOnError(false);
        stubExtraction();
        when(snapshotExporter.export(any())).thenThrow(exportFailure());

        ExtractionResult result = service.extract(REQUEST);

        assertThat(result.getExportCsvUrl()).isNull();
        assertThat(result.getPersonnelCount()).isEqualTo(4);
    }

    @Test
    void unexpectedFaultIsWrappedWithCause() {
        when(textAcquisitionService.acquire(REQUEST)).thenReturn(new ExtractionInput("Crew 4", TextSource.FORM_FIELD));
        IllegalStateException cause = new IllegalStateException("regex blew up");
        when(reportFieldExtractor.extract("Crew 4")).thenThrow(cause);

        assertThatThrownBy(() -> service.extract(REQUEST))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessage("Extraction failed: regex blew up")
                .hasCause(cause);
        verify(snapshotExporter, never()).export(any());
    }

    private void stubExtraction() {
        when(textAcquisitionService.acquire(REQUEST)).thenReturn(new ExtractionInput("Crew 4", TextSource.FORM_FIELD));
        when(reportFieldExtractor.extract("Crew 4")).thenReturn(result());
    }

    private static ExportWriteException exportFailure() {
        return new ExportWriteException("CSV snapshot write failed", Path.of("exports/scribe/x.csv"),
                new IOException("disk full"));
    }

    private static ExtractionResult result() {
        return ExtractionResult.builder()
                .personnelCount(4)
                .subcontractors(List.of())
                .completedTasks(List.of())
                .issues(List.of())
                .safetyObservations(List.of())
                .lowConfidence(true)
                .confidence(Map.of("personnel_count", 0.6, "date", 0.2))
                .build();
    }
}
