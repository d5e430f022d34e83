package com.basketgov.api;

import com.basketgov.error.ConflictException;
import com.basketgov.error.ExecutionFailureException;
import com.basketgov.error.ForbiddenException;
import com.basketgov.error.GovernanceDisabledException;
import com.basketgov.error.GovernanceException;
import com.basketgov.error.InvalidRequestException;
import com.basketgov.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error": "Proposal already executed: ...",
 *   "error_code": "ALREADY_EXECUTED",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse(ex);
    }

    @ExceptionHandler(ForbiddenException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return errorResponse(ex);
    }

    @ExceptionHandler(InvalidRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return errorResponse(ex);
    }

    @ExceptionHandler(ConflictException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleConflict(ConflictException ex) {
        log.warn("Proposal state conflict: {}", ex.getMessage());
        return errorResponse(ex);
    }

    @ExceptionHandler(ExecutionFailureException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleExecutionFailure(ExecutionFailureException ex) {
        log.error("Execution failed: {}", ex.getMessage(), ex.getCause());
        Map<String, Object> body = errorResponse(ex);
        body.put("failed_operation_index", ex.getFailedOperationIndex());
        return body;
    }

    @ExceptionHandler(GovernanceDisabledException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleGovernanceDisabled(GovernanceDisabledException ex) {
        Map<String, Object> body = errorResponse(ex);
        body.put("governance_status", "disabled");
        return body;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return errorResponse("UNPROCESSABLE_BODY", "request body is not valid JSON: " + ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    public Map<String, Object> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return errorResponse("UNSUPPORTED_MEDIA_TYPE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(GovernanceException ex) {
        return errorResponse(ex.errorCode(), ex.getMessage());
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("error_code", errorCode);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
