package com.skillforge.engine.model;

import com.skillforge.engine.spec.SkillSpecification;
import com.skillforge.engine.spec.SpecificationMissingException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The in-memory join of one skill's metadata with its full file set.
 *
 * Owned by the request that assembled it. {@code specification} is null when
 * the skill ships no SKILL.md; {@code specificationText} is then empty.
 */
public record SkillBundle(
        SkillMetadata      metadata,
        List<SkillFile>    files,
        String             specificationText,
        SkillSpecification specification,
        List<String>       warnings
) {

    public SkillBundle {
        files             = List.copyOf(files);
        warnings          = List.copyOf(warnings);
        specificationText = specificationText == null ? "" : specificationText;
    }

    public String skillId() {
        return metadata.skillId();
    }

    public boolean hasSpecification() {
        return specification != null;
    }

    /** @throws SpecificationMissingException if the skill ships no SKILL.md */
    public SkillSpecification requireSpecification(String operation) {
        if (specification == null) {
            throw new SpecificationMissingException(operation, skillId());
        }
        return specification;
    }

    public Optional<SkillFile> file(String filePath) {
        return files.stream().filter(f -> f.filePath().equals(filePath)).findFirst();
    }

    /**
     * Single-document view kept for consumers written against the original
     * one-record-per-skill layout: the metadata fields plus {@code skill_markdown}.
     */
    public Map<String, Object> legacyDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("skill_id",          metadata.skillId());
        doc.put("name",              metadata.name());
        doc.put("description",       metadata.description());
        doc.put("short_description", metadata.shortDescription());
        doc.put("domain",            metadata.domain());
        doc.put("tags",              metadata.tags());
        doc.put("author",            metadata.author());
        doc.put("version",           metadata.version());
        doc.put("rating",            metadata.rating());
        doc.put("usage_count",       metadata.usageCount());
        doc.put("success_rate",      metadata.successRate());
        doc.put("skill_markdown",    specificationText);
        doc.put("file_count",        files.size());
        return doc;
    }
}
