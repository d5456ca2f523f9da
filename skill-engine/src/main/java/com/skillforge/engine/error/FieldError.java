package com.skillforge.engine.error;

/** One field-level validation failure: the offending field and what is wrong with it. */
public record FieldError(String field, String message) {}
