package com.skillforge.engine.model;

import java.util.List;

/**
 * Search/listing view of a skill: identity, classification and the fused
 * relevance score (1.0 for pure filter browsing).
 */
public record SkillSummary(
        String       skillId,
        String       name,
        String       domain,
        String       shortDescription,
        List<String> tags,
        double       rating,
        double       score
) {}
