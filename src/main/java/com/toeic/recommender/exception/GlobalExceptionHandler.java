package com.toeic.recommender.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientCatalogException.class)
    public ResponseEntity<ApiError> handleInsufficientCatalog(InsufficientCatalogException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Insufficient catalog [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, errorId, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ApiError> handleUpstreamUnavailable(UpstreamUnavailableException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Upstream unavailable [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ex.getCode(),
                "Learning data is temporarily unavailable. Please try again.", request);
    }

    @ExceptionHandler(UpstreamAuthException.class)
    public ResponseEntity<ApiError> handleUpstreamAuth(UpstreamAuthException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Upstream rejected credentials [{}]: status={} {}", errorId, ex.getStatus(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, errorId, ex.getCode(),
                "Backend rejected the recommender's credentials", request);
    }

    @ExceptionHandler(InvalidFeatureDimensionException.class)
    public ResponseEntity<ApiError> handleInvalidFeatureDimension(InvalidFeatureDimensionException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Catalog contract violation [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, errorId, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");
        log.warn("Validation error [{}]: {}", errorId, message);
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Bad request [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String errorId, String code, String message,
                                             HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
