package com.baykanat.bloganalytics.api.exception;

import com.baykanat.bloganalytics.domain.exception.AnalyticsRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** REST hatalarını tek yerde toplar: 400 istemci hataları (kodlu), 500 diğer her şey (storage dahil). */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /** Filtre, granularity, tarih ve dimension hataları → 400 + hata kodu. */
    @ExceptionHandler(AnalyticsRequestException.class)
    public ResponseEntity<Map<String, Object>> handleAnalyticsRequest(AnalyticsRequestException ex) {
        log.debug("Rejected analytics request: {} {}", ex.getCode(), ex.getMessage());

        Map<String, Object> body = errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
        body.put("code", ex.getCode());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /** @RequestBody validasyon hataları → 400, alan bazlı detay. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"
                ))
                .toList();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Validation failed", fieldErrors));
    }

    /** Okunamayan JSON gövdesi → 400. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Malformed request body", null));
    }

    /** Beklenmeyen hatalar → 500, istemciye jenerik mesaj. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null));
    }

    private Map<String, Object> errorBody(HttpStatus status, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
