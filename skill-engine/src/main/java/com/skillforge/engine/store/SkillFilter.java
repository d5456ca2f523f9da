package com.skillforge.engine.store;

import com.skillforge.engine.model.SkillMetadata;

import java.util.Collection;
import java.util.List;

/**
 * Attribute filter: equality on domain, set membership on tags.
 *
 * Values are normalized the same way as at write time, so matching is
 * case-insensitive. {@code matchAllTags} selects between requiring every
 * requested tag and requiring at least one.
 */
public record SkillFilter(String domain, List<String> tags, boolean matchAllTags) {

    public static final SkillFilter NONE = new SkillFilter(null, List.of(), false);

    public SkillFilter {
        domain = domain == null || domain.isBlank() ? null : SkillMetadata.normalizeDomain(domain);
        tags   = SkillMetadata.normalizeTags(tags);
    }

    public static SkillFilter of(String domain, Collection<String> tags, boolean matchAllTags) {
        return new SkillFilter(domain, tags == null ? List.of() : List.copyOf(tags), matchAllTags);
    }

    public static SkillFilter domain(String domain) {
        return new SkillFilter(domain, List.of(), false);
    }

    public boolean isEmpty() {
        return domain == null && tags.isEmpty();
    }

    public boolean matches(SkillMetadata skill) {
        if (domain != null && !domain.equals(skill.domain())) {
            return false;
        }
        if (tags.isEmpty()) {
            return true;
        }
        return matchAllTags
                ? skill.tags().containsAll(tags)
                : tags.stream().anyMatch(skill.tags()::contains);
    }
}
