package com.skillforge.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/v1/jobs.
 *
 * {@code operation} is one of {@code setup}, {@code teardown}, {@code update-skills}.
 * {@code params} is optional: {@code recreate} for setup, {@code folder} for update-skills.
 */
public record SubmitJobRequest(String operation, Map<String, Object> params) {}
