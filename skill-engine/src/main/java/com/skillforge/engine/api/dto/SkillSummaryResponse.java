package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.model.SkillSummary;

import java.util.List;

/** One search or listing hit. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SkillSummaryResponse(
        String       skillId,
        String       name,
        String       domain,
        String       shortDescription,
        List<String> tags,
        double       rating,
        double       score
) {
    public static SkillSummaryResponse from(SkillSummary s) {
        return new SkillSummaryResponse(s.skillId(), s.name(), s.domain(), s.shortDescription(),
                s.tags(), s.rating(), s.score());
    }
}
