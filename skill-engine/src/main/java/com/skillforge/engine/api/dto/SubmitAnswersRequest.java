package com.skillforge.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/v1/sessions/{sessionId}/answers.
 * Omit {@code groupIndex} to answer the current group; an earlier index corrects that group.
 */
public record SubmitAnswersRequest(Integer groupIndex, Map<String, Object> answers) {}
