package com.sitepulse.scribe.config;

import com.sitepulse.scribe.exception.ExportWriteException;
import com.sitepulse.scribe.exception.ExtractionFailedException;
import com.sitepulse.scribe.exception.NoTextAvailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(NoTextAvailableException.class)
    public ResponseEntity<Map<String, Object>> handleNoText(NoTextAvailableException ex) {
        return body(HttpStatus.BAD_REQUEST, "no_text_available", ex.getMessage());
    }

    @ExceptionHandler(ExtractionFailedException.class)
    public ResponseEntity<Map<String, Object>> handleExtractionFailed(ExtractionFailedException ex) {
        return body(HttpStatus.BAD_REQUEST, "extraction_failed", ex.getMessage());
    }

    @ExceptionHandler(ExportWriteException.class)
    public ResponseEntity<Map<String, Object>> handleExportWrite(ExportWriteException ex) {
        log.warn("Snapshot export failed for {}: {}", ex.getTarget(), ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "export_write_failed", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Rejected upload over the size limit: {}", ex.getMessage());
        return body(HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", ex.getMessage());
    }

    /**
     * Framework exceptions (unknown route, wrong method, unsupported media type, ...)
     * carry their own status and are not server faults.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null) {
                log.debug("Request rejected with {}: {}", status, ex.getMessage());
                String detail = errorResponse.getBody().getDetail();
                return body(status, status.name().toLowerCase(Locale.ROOT), detail != null ? detail : ex.getMessage());
            }
        }
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "error", error,
                "message", message == null ? error : message
        ));
    }
}
