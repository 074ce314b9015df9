package com.coordinator.api.rest;

import com.coordinator.core.exception.CoordinatorException;
import com.coordinator.core.exception.DuplicateTaskException;
import com.coordinator.core.exception.InvalidTransitionException;
import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.exception.NotificationFormatException;
import com.coordinator.core.exception.StableIdConflictException;
import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.exception.ValidationGateException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps coordinator exceptions to HTTP statuses. The body always carries the error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String BAD_REQUEST_CODE = "BAD_REQUEST";
    public static final String INTERNAL_ERROR_CODE = "INTERNAL_ERROR";

    private static final Map<String, HttpStatus> STATUS_BY_CODE = Map.of(
        NotFoundException.ERROR_CODE, HttpStatus.NOT_FOUND,
        DuplicateTaskException.ERROR_CODE, HttpStatus.CONFLICT,
        InvalidTransitionException.ERROR_CODE, HttpStatus.CONFLICT,
        StableIdConflictException.ERROR_CODE, HttpStatus.CONFLICT,
        ValidationGateException.ERROR_CODE, HttpStatus.UNPROCESSABLE_ENTITY,
        NotificationFormatException.ERROR_CODE, HttpStatus.BAD_REQUEST,
        TransientStoreException.ERROR_CODE, HttpStatus.SERVICE_UNAVAILABLE
    );

    public record ErrorResponse(String errorCode, String message) {}

    @ExceptionHandler(CoordinatorException.class)
    public ResponseEntity<ErrorResponse> handleCoordinatorException(CoordinatorException ex, HttpServletRequest request) {
        HttpStatus status = STATUS_BY_CODE.getOrDefault(ex.getErrorCode(), HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("{} {} failed with {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} bad request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST_CODE, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed unexpectedly", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR_CODE, "Internal error"));
    }
}
