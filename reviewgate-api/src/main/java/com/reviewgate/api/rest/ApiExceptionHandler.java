package com.reviewgate.api.rest;

import com.reviewgate.core.exception.DefinitionValidationException;
import com.reviewgate.core.exception.InvalidStateTransitionException;
import com.reviewgate.core.exception.LeaseDeniedException;
import com.reviewgate.core.exception.NotFoundException;
import com.reviewgate.core.exception.ReviewGateException;
import com.reviewgate.core.exception.StateConflictException;
import com.reviewgate.core.exception.StateCorruptionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

/**
 * Maps engine exceptions to HTTP responses with a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return reject(HttpStatus.NOT_FOUND, ex, List.of(), request);
    }

    @ExceptionHandler(DefinitionValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDefinition(
            DefinitionValidationException ex, HttpServletRequest request) {
        return reject(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getViolations(), request);
    }

    @ExceptionHandler({
        InvalidStateTransitionException.class,
        StateConflictException.class,
        LeaseDeniedException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(ReviewGateException ex, HttpServletRequest request) {
        return reject(HttpStatus.CONFLICT, ex, List.of(), request);
    }

    @ExceptionHandler(StateCorruptionException.class)
    public ResponseEntity<ErrorResponse> handleCorruption(StateCorruptionException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getErrorCode(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(ex.getErrorCode(), truncate(ex.getMessage()), List.of()));
    }

    @ExceptionHandler(ReviewGateException.class)
    public ResponseEntity<ErrorResponse> handleOther(ReviewGateException ex, HttpServletRequest request) {
        return reject(HttpStatus.BAD_REQUEST, ex, List.of(), request);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage());
        logWarn(request, ex, BAD_REQUEST, message);
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(BAD_REQUEST, message, List.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
            INTERNAL_ERROR, truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(INTERNAL_ERROR, "Internal error", List.of()));
    }

    private ResponseEntity<ErrorResponse> reject(
            HttpStatus status, ReviewGateException ex, List<String> details, HttpServletRequest request) {
        String message = truncate(ex.getMessage());
        logWarn(request, ex, ex.getErrorCode(), message);
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(ex.getErrorCode(), message, details));
    }

    private static void logWarn(HttpServletRequest request, Exception ex, String code, String message) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), code, message);
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }

    public record ErrorResponse(
        String code,
        String message,
        List<String> details,
        Instant timestamp
    ) {
        static ErrorResponse of(String code, String message, List<String> details) {
            return new ErrorResponse(code, message, details, Instant.now());
        }
    }
}
