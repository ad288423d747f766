package com.teachertraining.api.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps failures to HTTP statuses. Bodies carry a {@code detail} that is either
 * a message or, for input errors, a list of {field, message} pairs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String BODY_FIELD = "body";

    @ExceptionHandler(ModuleNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ModuleNotFoundException ex) {
        log.debug("Module {} not found", ex.getModuleId());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({InvalidIdentifierException.class, ModuleLookupException.class})
    public ResponseEntity<Map<String, Object>> handleBadLookup(RuntimeException ex) {
        log.warn("Rejected module lookup: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<Map<String, String>> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(this::fieldError)
                .toList();
        return error(HttpStatus.UNPROCESSABLE_ENTITY, errors);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, List.of(fieldError(ex.getField(), ex.getMessage())));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY,
                List.of(fieldError(ex.getParameterName(), "query parameter is required")));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY,
                List.of(fieldError(ex.getName(), "has the wrong type")));
    }

    /**
     * A value of the wrong JSON type is reported against its path in the body,
     * e.g. {@code timestamps[0].time}. Anything else unreadable is reported against {@code body}.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        // No stack trace, client error
        log.debug("Unreadable request body: {}", ex.getMessage());
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY,
                    List.of(fieldError(jsonPath(mismatch.getPath()), "has the wrong type")));
        }
        return error(HttpStatus.UNPROCESSABLE_ENTITY,
                List.of(fieldError(BODY_FIELD, "Request body is missing or is not valid JSON for this endpoint")));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("Storage failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    /** Framework errors (unknown path, wrong method...) keep their own status. */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<Map<String, Object>> handleServlet(ServletException ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return error(HttpStatus.valueOf(status.value()), ex.getMessage());
        }
        return handleGeneric(ex);
    }

    /** Catch-all, never expose internal detail */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    private Map<String, String> fieldError(FieldError error) {
        return fieldError(error.getField(), error.getDefaultMessage());
    }

    private Map<String, String> fieldError(String field, String message) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("field", toWireName(field));
        entry.put("message", message);
        return entry;
    }

    static String jsonPath(List<JsonMappingException.Reference> path) {
        StringBuilder field = new StringBuilder();
        for (JsonMappingException.Reference reference : path) {
            if (reference.getFieldName() != null) {
                if (!field.isEmpty()) {
                    field.append('.');
                }
                field.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                field.append('[').append(reference.getIndex()).append(']');
            }
        }
        return field.toString();
    }

    // videoUrl -> video_url, resources[0].url stays as is
    static String toWireName(String field) {
        return field == null ? null : field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, Object detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", detail);
        body.put("status", status.value());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
