package com.skillforge.engine.spec;

import java.util.List;
import java.util.Optional;

/**
 * The structured reading of a skill's SKILL.md: identity and classification
 * for the Metadata Store, plus the execution sub-schema (entry point, inputs,
 * output adapter, parameter groups). Re-derived on every assembly.
 *
 * Identity fields may be null when neither the front matter nor the markdown
 * declares them; the ingestion layer applies the defaults.
 */
public record SkillSpecification(
        String                 skillId,
        String                 name,
        String                 description,
        String                 domain,
        List<String>           tags,
        String                 author,
        String                 version,
        Double                 rating,
        EntryPoint             entryPoint,
        List<InputDeclaration> inputs,
        OutputAdapter          outputAdapter,
        List<ParameterGroup>   parameterGroups
) {

    public SkillSpecification {
        tags            = tags == null ? List.of() : List.copyOf(tags);
        inputs          = inputs == null ? List.of() : List.copyOf(inputs);
        parameterGroups = parameterGroups == null ? List.of() : List.copyOf(parameterGroups);
    }

    public boolean hasParameterGroups() {
        return !parameterGroups.isEmpty();
    }

    public Optional<EntryPoint> entryPointIfDeclared() {
        return Optional.ofNullable(entryPoint);
    }

    public Optional<OutputAdapter> outputAdapterIfDeclared() {
        return Optional.ofNullable(outputAdapter);
    }
}
