package com.fhi.farm_breeding.api.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fhi.farm_breeding.service.exception.breeding.BreedingException;
import com.fhi.farm_breeding.service.exception.breeding.BreedingException.Cause;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;


/**
 * Translates domain and persistence failures into HTTP responses.
 *
 * <p>Lives in the API layer, away from {@link BreedingException}: the service layer states what
 * went wrong, this class decides how clients see it. Every response body has the same shape:
 * <pre>
 *   { "timestamp": "...", "code": "ALREADY_PREGNANT", "message": "Dam RAB25001 (#7) already has an active pregnancy" }
 * </pre>
 */
@RestControllerAdvice
@Slf4j
public class BreedingExceptionHandler
{
    @ExceptionHandler(BreedingException.class)
    public ResponseEntity<Map<String, Object>> handleBreedingException(BreedingException ex)
    {
        HttpStatus status = mapCauseToStatus(ex.getCauseEnum());
        if (status.is5xxServerError())
        {   log.error("Breeding operation failed: {}", ex.toString(), ex);
        }
        else
        {   log.debug("Breeding operation refused: {}", ex.toString());
        }
        return body(status, ex.getCauseEnum().getCode(), ex.getMessage());
    }

    /**
     * Bean-validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException ex)
    {
        String message = ex.getBindingResult().getFieldErrors().stream()
                           .map(error -> error.getField() + " " + error.getDefaultMessage())
                           .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, Cause.VALIDATION_ERROR.getCode(), message);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex)
    {   return body(HttpStatus.BAD_REQUEST, Cause.VALIDATION_ERROR.getCode(), ex.getMessage());
    }

    /**
     * Requests without a caller identity.
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingCaller(MissingRequestHeaderException ex)
    {   return body(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "Missing request header " + ex.getHeaderName());
    }

    /**
     * A uniqueness constraint fired: a concurrent request created the same active pregnancy,
     * birth event or offspring tag first.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrityViolation(DataIntegrityViolationException ex)
    {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.CONFLICT, Cause.CONFLICT.getCode(),
                    "The request conflicts with a concurrent change, please retry");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex)
    {
        log.error("Persistence failure", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, Cause.UNKNOWN.getCode(), "Persistence failure");
    }


    /**
     * Rationale behind the mapping:
     *   - 404/403: the referenced record is absent, or belongs to someone else's farm
     *   - 400: the request itself is wrong (counts, immutable fields, disabled features)
     *   - 409: the request is fine but the current state forbids it
     *   - 422: a sire/dam role is given to an animal of the wrong sex
     *   - 500: a multi-step write broke halfway, or something unknown happened
     */
    private HttpStatus mapCauseToStatus(Cause cause)
    {
        return switch (cause)
        {
            case NOT_FOUND              -> HttpStatus.NOT_FOUND;
            case PERMISSION_DENIED      -> HttpStatus.FORBIDDEN;
            case INVALID_SEX            -> HttpStatus.UNPROCESSABLE_ENTITY;
            case FEATURE_DISABLED,
                 VALIDATION_ERROR,
                 IMMUTABLE_FIELD_CHANGE -> HttpStatus.BAD_REQUEST;
            case ALREADY_PREGNANT,
                 ALREADY_TERMINAL,
                 CONFLICT,
                 INVALID_TRANSITION     -> HttpStatus.CONFLICT;
            case INCONSISTENT_STATE,
                 UNKNOWN                -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
