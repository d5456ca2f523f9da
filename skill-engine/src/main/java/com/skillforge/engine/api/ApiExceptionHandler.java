package com.skillforge.engine.api;

import com.skillforge.engine.api.dto.ErrorResponse;
import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.FieldError;
import com.skillforge.engine.error.SkillEngineException;
import com.skillforge.engine.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps every {@link SkillEngineException} to an HTTP status and an
 * {@link ErrorResponse} body carrying the error code, operation and key.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SkillEngineException.class)
    public ResponseEntity<ErrorResponse> handle(SkillEngineException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.info("Request rejected: {}", e.getMessage());
        }
        List<FieldError> fieldErrors =
                e instanceof ValidationException v ? v.getFieldErrors() : List.of();
        return ResponseEntity.status(status).body(new ErrorResponse(
                e.getCode().name(), e.getOperation(), e.getKey(), e.getReason(), fieldErrors));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.info("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ErrorCode.VALIDATION_ERROR.name(), "request", null, e.getMessage(), List.of()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case SKILL_NOT_FOUND, JOB_NOT_FOUND, SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, MISSING_REQUIRED_INPUT          -> HttpStatus.BAD_REQUEST;
            case SESSION_ABANDONED                                 -> HttpStatus.GONE;
            case SPECIFICATION_MISSING, ENTRY_POINT_NOT_FOUND,
                 OUTPUT_ADAPTER_MISMATCH                           -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SEARCH_UNAVAILABLE, STORE_UNAVAILABLE             -> HttpStatus.SERVICE_UNAVAILABLE;
            case RUNTIME_FAULT, INGESTION_PARTIAL_FAILURE          -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
