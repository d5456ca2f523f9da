package com.skillforge.engine.api.dto;

import java.util.Map;

/** Request body for POST /api/v1/skills/{skillId}/execute. */
public record ExecuteRequest(Map<String, Object> parameters) {}
