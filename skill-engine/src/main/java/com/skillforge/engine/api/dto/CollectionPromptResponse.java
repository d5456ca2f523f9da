package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.collect.CollectionPrompt;
import com.skillforge.engine.spec.ParameterField;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Either the next group to render ({@code status=collecting}) or the complete
 * parameter set ({@code status=complete}).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollectionPromptResponse(
        String              sessionId,
        String              skillId,
        String              status,
        int                 groupIndex,
        int                 groupCount,
        String              groupName,
        String              prompt,
        List<Field>         fields,
        Map<String, Object> collected
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Field(
            String       name,
            String       type,
            boolean      required,
            Double       min,
            Double       max,
            String       pattern,
            List<Object> choices,
            String       description
    ) {
        static Field from(ParameterField f) {
            return new Field(f.name(), f.type().wireName(), f.required(), f.min(), f.max(), f.pattern(),
                    f.choices().isEmpty() ? null : f.choices(), f.description());
        }
    }

    public static CollectionPromptResponse from(CollectionPrompt p) {
        return new CollectionPromptResponse(
                p.sessionId(),
                p.skillId(),
                p.status().name().toLowerCase(Locale.ROOT),
                p.groupIndex(),
                p.groupCount(),
                p.groupName(),
                p.prompt(),
                p.fields().stream().map(Field::from).toList(),
                p.collected());
    }
}
