package com.skillforge.engine.model;

/**
 * One skill directory that could not be ingested. Recorded in the job result;
 * never aborts ingestion of the remaining skills.
 */
public record IngestionFailure(String skillId, String reason) {}
