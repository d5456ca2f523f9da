package com.skillforge.engine.search;

import java.util.List;

/**
 * One search call. {@code query} may be blank when a domain or tag filter is
 * set (pure filter browse); {@code limit} null means the configured default.
 */
public record SearchRequest(
        String       query,
        String       domain,
        List<String> tags,
        boolean      matchAllTags,
        Integer      limit
) {
    public SearchRequest {
        query = query == null ? "" : query.strip();
        tags  = tags == null ? List.of() : List.copyOf(tags);
    }

    public static SearchRequest of(String query, int limit) {
        return new SearchRequest(query, null, List.of(), false, limit);
    }
}
