package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.model.SkillMetadata;

import java.time.Instant;
import java.util.List;

/** Metadata-only view of a skill; never carries file content. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SkillMetadataResponse(
        String       skillId,
        String       name,
        String       description,
        String       shortDescription,
        String       domain,
        List<String> tags,
        String       author,
        String       version,
        double       rating,
        long         usageCount,
        double       successRate,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static SkillMetadataResponse from(SkillMetadata m) {
        return new SkillMetadataResponse(
                m.skillId(), m.name(), m.description(), m.shortDescription(), m.domain(), m.tags(),
                m.author(), m.version(), m.rating(), m.usageCount(), m.successRate(),
                m.createdAt(), m.updatedAt());
    }
}
