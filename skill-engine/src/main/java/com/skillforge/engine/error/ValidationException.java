package com.skillforge.engine.error;

import java.util.List;

/**
 * Caller input was rejected. Carries every field-level error found, so the
 * caller can fix all of them in one round trip.
 */
public class ValidationException extends SkillEngineException {

    private final List<FieldError> fieldErrors;

    public ValidationException(String operation, String key, String cause) {
        this(operation, key, cause, List.of());
    }

    public ValidationException(String operation, String key, String cause, List<FieldError> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, operation, key, cause);
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public List<FieldError> getFieldErrors() { return fieldErrors; }
}
