package com.adlanda.docretrieval.controller;

import com.adlanda.docretrieval.exception.DimensionMismatchException;
import com.adlanda.docretrieval.exception.EmbeddingMismatchException;
import com.adlanda.docretrieval.exception.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps retrieval failures to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Request body failed validation";
        }
        log.warn("Rejected request body: {}", message);
        return body(HttpStatus.BAD_REQUEST, "bad_request", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "bad_request", "Request body is missing or malformed");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, String>> handleMissingPart(MissingServletRequestPartException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "bad_request", "Required part '" + e.getRequestPartName() + "' is missing");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "bad_request", "Required parameter '" + e.getParameterName() + "' is missing");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Rejected upload: {}", e.getMessage());
        String limit = e.getMaxUploadSize() >= 0 ? " of " + e.getMaxUploadSize() + " bytes" : "";
        return body(HttpStatus.BAD_REQUEST, "bad_request", "Upload exceeds the maximum size" + limit);
    }

    @ExceptionHandler({EmbeddingMismatchException.class, DimensionMismatchException.class})
    public ResponseEntity<Map<String, String>> handleEmbeddingFailure(RetrievalException e) {
        log.error("Embedding provider returned an unusable batch: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "embedding_mismatch", e.getMessage());
    }

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<Map<String, String>> handleRetrievalFailure(RetrievalException e) {
        log.error("Retrieval failure: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "retrieval_error", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException e) {
        log.error("Store refused the operation: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "retrieval_error", e.getMessage());
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message != null ? message : ""
        ));
    }
}
