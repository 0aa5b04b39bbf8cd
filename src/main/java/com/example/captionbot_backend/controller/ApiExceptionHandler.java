package com.example.captionbot_backend.controller;

import com.example.captionbot_backend.dto.caption.TierError;
import com.example.captionbot_backend.dto.web.ApiError;
import com.example.captionbot_backend.exception.AnalysisException;
import com.example.captionbot_backend.exception.InvalidReferenceException;
import com.example.captionbot_backend.exception.StorageException;
import com.example.captionbot_backend.exception.TranscriptAcquisitionException;
import com.example.captionbot_backend.exception.TranscriptNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses with an {@link ApiError} body.
 */
@RestControllerAdvice
class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    ResponseEntity<ApiError> handleInvalidReference(InvalidReferenceException ex) {
        LOGGER.warn("Invalid reference: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REFERENCE", ex.getMessage(), null);
    }

    /**
     * Terminal upstream states are reported as 404, exhausted fallbacks as 422.
     */
    @ExceptionHandler(TranscriptAcquisitionException.class)
    ResponseEntity<ApiError> handleAcquisition(TranscriptAcquisitionException ex) {
        List<Map<String, String>> tiers = ex.getErrors().stream().map(ApiExceptionHandler::describe).toList();
        if (ex.isTerminal()) {
            return error(HttpStatus.NOT_FOUND, "CAPTIONS_UNAVAILABLE", ex.getMessage(), tiers);
        }
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "TRANSCRIPT_UNAVAILABLE", ex.getMessage(), tiers);
    }

    @ExceptionHandler(TranscriptNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(TranscriptNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(AnalysisException.class)
    ResponseEntity<ApiError> handleAnalysis(AnalysisException ex) {
        LOGGER.error("Analysis failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "ANALYSIS_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOGGER.error("Storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Transcript storage failed", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.put(fe.getField(), fe.getDefaultMessage()));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request body is invalid", fields);
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String code, String message, Object details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    private static Map<String, String> describe(TierError error) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("tier", error.tier().name());
        out.put("kind", error.kind().name());
        out.put("message", error.message());
        return out;
    }
}
