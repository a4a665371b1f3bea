package com.conductor.dispatch.api;

import com.conductor.core.error.AlreadyRunningException;
import com.conductor.core.error.BranchNotFoundException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.error.NoActiveSessionException;
import com.conductor.core.error.UnknownProjectException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps orchestration failures to HTTP responses with an {@code {error, code}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConductorException.class)
    public ResponseEntity<Map<String, String>> handleConductorException(ConductorException ex,
                                                                        HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getCode(),
                ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", ex.getMessage(), "code", ex.getCode()));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = ex.getMessage() == null ? "Bad request" : ex.getMessage();
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(Map.of("error", message, "code", "BAD_REQUEST"));
    }

    static HttpStatus statusFor(ConductorException ex) {
        if (ex instanceof UnknownProjectException || ex instanceof BranchNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof NoActiveSessionException || ex instanceof AlreadyRunningException) {
            return HttpStatus.CONFLICT;
        }
        return switch (ex.getOrigin()) {
            case REQUEST -> HttpStatus.BAD_REQUEST;
            case AGENT, INFRASTRUCTURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
