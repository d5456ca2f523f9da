package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.error.FieldError;

import java.util.List;

/** Body of every error response. {@code fieldErrors} only appears for validation failures. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String           error,
        String           operation,
        String           key,
        String           message,
        List<FieldError> fieldErrors
) {}
