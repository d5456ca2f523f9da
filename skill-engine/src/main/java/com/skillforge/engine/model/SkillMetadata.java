package com.skillforge.engine.model;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One record of the Metadata Store: everything about a skill except its files.
 *
 * {@code domain} and {@code tags} are trimmed and lowercased here so that every
 * write path stores them case-normalized. {@code revision} is stamped by the
 * ingestion pass that produced the record; the File Store records written by
 * the same pass carry the same revision. {@code fileCount} is the size of
 * that file set, or -1 when unknown (records written before it was tracked).
 */
public record SkillMetadata(
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
        String       searchableText,
        int          fileCount,
        String       revision,
        Instant      createdAt,
        Instant      updatedAt
) {

    public static final int SHORT_DESCRIPTION_LENGTH = 200;

    public SkillMetadata {
        Objects.requireNonNull(skillId, "skillId");
        if (skillId.isBlank()) {
            throw new IllegalArgumentException("skillId must not be blank");
        }
        name        = name == null || name.isBlank() ? skillId : name.strip();
        description = description == null ? "" : description.strip();
        if (shortDescription == null) {
            shortDescription = shorten(description);
        }
        domain = normalizeDomain(domain);
        tags   = normalizeTags(tags);
        if (searchableText == null) {
            searchableText = searchableText(name, description, tags);
        }
    }

    /** Lowercased, trimmed domain; {@code general} when absent. */
    public static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) return "general";
        return domain.strip().toLowerCase(Locale.ROOT);
    }

    /** Sorted, de-duplicated, lowercased tags without blanks. */
    public static List<String> normalizeTags(Collection<String> tags) {
        if (tags == null) return List.of();
        TreeSet<String> normalized = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.strip().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(normalized);
    }

    private static String shorten(String description) {
        return description.length() > SHORT_DESCRIPTION_LENGTH
                ? description.substring(0, SHORT_DESCRIPTION_LENGTH)
                : description;
    }

    private static String searchableText(String name, String description, List<String> tags) {
        StringBuilder sb = new StringBuilder(name);
        if (!description.isEmpty()) sb.append('\n').append(description);
        if (!tags.isEmpty())        sb.append('\n').append(String.join(" ", tags));
        return sb.toString();
    }

    public SkillSummary toSummary(double score) {
        return new SkillSummary(skillId, name, domain, shortDescription, tags, rating, score);
    }
}
