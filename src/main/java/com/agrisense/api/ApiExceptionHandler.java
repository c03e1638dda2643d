package com.agrisense.api;

import com.agrisense.engine.CycleLimitExceededException;
import com.agrisense.engine.SessionCancelledException;
import com.agrisense.fact.DuplicateFactException;
import com.agrisense.fact.UnknownFactException;
import com.agrisense.session.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
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
 *   "error_code": "DUPLICATE_FACT",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DuplicateFactException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateFact(DuplicateFactException ex) {
        Map<String, Object> body = errorResponse("DUPLICATE_FACT", ex.getMessage());
        body.put("existing_fact_id", ex.getExistingFactId());
        return body;
    }

    @ExceptionHandler(UnknownFactException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownFact(UnknownFactException ex) {
        return errorResponse("UNKNOWN_FACT", ex.getMessage());
    }

    @ExceptionHandler(UnknownSessionException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownSession(UnknownSessionException ex) {
        return errorResponse("UNKNOWN_SESSION", ex.getMessage());
    }

    @ExceptionHandler(CycleLimitExceededException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleCycleLimit(CycleLimitExceededException ex) {
        log.warn("Cycle limit exceeded: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("CYCLE_LIMIT_EXCEEDED", ex.getMessage());
        body.put("max_cycles", ex.getMaxCycles());
        body.put("recent_firings", ex.getRecentFirings());
        return body;
    }

    @ExceptionHandler(SessionCancelledException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleCancelled(SessionCancelledException ex) {
        return errorResponse("SESSION_CANCELLED", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIllegalState(IllegalStateException ex) {
        return errorResponse("INVALID_SESSION_STATE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
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

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
