package com.skillforge.engine.error;

/**
 * Every failure the engine reports carries one of these codes.
 *
 * Infrastructure codes ({@link #SEARCH_UNAVAILABLE}, {@link #STORE_UNAVAILABLE})
 * are retried a bounded number of times before they surface. All others point
 * at a caller or data-authoring defect and surface immediately.
 */
public enum ErrorCode {
    SKILL_NOT_FOUND(false),
    SPECIFICATION_MISSING(false),
    SEARCH_UNAVAILABLE(true),
    STORE_UNAVAILABLE(true),
    VALIDATION_ERROR(false),
    SESSION_NOT_FOUND(false),
    SESSION_ABANDONED(false),
    ENTRY_POINT_NOT_FOUND(false),
    MISSING_REQUIRED_INPUT(false),
    RUNTIME_FAULT(false),
    OUTPUT_ADAPTER_MISMATCH(false),
    JOB_NOT_FOUND(false),
    INGESTION_PARTIAL_FAILURE(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
