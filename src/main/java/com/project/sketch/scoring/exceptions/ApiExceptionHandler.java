package com.project.sketch.scoring.exceptions;

import com.project.sketch.scoring.DTOs.ErrorResponse;
import com.project.sketch.scoring.controller.ScoringApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * JSON errors for the game API. Ordered before {@link GlobalExceptionHandler} so API calls never
 * get an HTML page back.
 */
@RestControllerAdvice(assignableTypes = ScoringApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ImageDecodeException.class)
    public ResponseEntity<ErrorResponse> handleDecode(ImageDecodeException ex) {
        log.warn("Undecodable image: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid image", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, StorageException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", details);
        return error(HttpStatus.BAD_REQUEST, "Missing sketch or referenceUrl", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", null);
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDimensionMismatch(DimensionMismatchException ex) {
        log.error("Normalization produced mismatched buffers", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Scoring failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.error("Scoring error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Scoring failed", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String details) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, details));
    }
}
