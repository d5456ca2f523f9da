package com.skillforge.engine.api.dto;

/** Request body for POST /api/v1/skills/{skillId}/sessions. */
public record StartCollectionRequest(String callerId) {}
