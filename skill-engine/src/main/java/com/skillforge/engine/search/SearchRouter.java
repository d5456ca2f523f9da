package com.skillforge.engine.search;

import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.model.SkillMetadata;
import com.skillforge.engine.model.SkillSummary;
import com.skillforge.engine.store.ScoredSkill;
import com.skillforge.engine.store.SkillFilter;
import com.skillforge.engine.store.SkillStore;
import com.skillforge.engine.store.StoreRetry;
import com.skillforge.engine.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Tri-mode skill search over the Metadata Store.
 *
 * <ul>
 *   <li><b>keyword</b>: full-text match on name and description;</li>
 *   <li><b>attribute</b>: equality on domain, membership on tags;</li>
 *   <li><b>similarity</b>: meaning-based match on the searchable text.</li>
 * </ul>
 *
 * With a non-blank query the keyword and similarity modes run with the
 * attribute filter pushed down into both. With a blank query the attribute
 * mode runs alone as a filter browse ordered by rating.
 *
 * Each mode's scores are normalized to [0, 1] by dividing by that mode's top
 * score. Results are fused per skill by taking the maximum, never the sum, so
 * a skill matching on both axes is not counted twice. Ties break by rating,
 * then by skill id.
 */
@Component
public class SearchRouter {

    private static final Logger log = LoggerFactory.getLogger(SearchRouter.class);

    private static final Comparator<SkillSummary> RANKING = Comparator
            .comparingDouble(SkillSummary::score).reversed()
            .thenComparing(Comparator.comparingDouble(SkillSummary::rating).reversed())
            .thenComparing(SkillSummary::skillId);

    private final SkillStore store;
    private final StoreRetry retry;
    private final int        defaultLimit;

    public SearchRouter(SkillStore store,
                        StoreRetry retry,
                        @Value("${skillforge.search.default-limit:5}") int defaultLimit) {
        this.store        = store;
        this.retry        = retry;
        this.defaultLimit = defaultLimit;
    }

    // ------------------------------------------------------------------
    // Search
    // ------------------------------------------------------------------

    /**
     * @throws ValidationException        if limit is negative
     * @throws SearchUnavailableException if the store stays unreachable through every retry
     */
    public List<SkillSummary> search(SearchRequest request) {
        int limit = request.limit() == null ? defaultLimit : request.limit();
        if (limit < 0) {
            throw new ValidationException("search", "query=" + request.query(),
                    "limit must be >= 0, got " + limit);
        }
        if (limit == 0) {
            return List.of();
        }

        SkillFilter filter = SkillFilter.of(request.domain(), request.tags(), request.matchAllTags());
        String key = "query=" + request.query();

        if (request.query().isEmpty()) {
            List<SkillMetadata> browsed = call("filterBrowse", key, () -> store.list(filter, limit));
            log.debug("Filter browse {} returned {} skills", filter, browsed.size());
            return browsed.stream().map(s -> s.toSummary(1.0)).toList();
        }

        // Fetch a wider window per mode so fusion can promote skills that rank
        // lower in one mode but higher in the other.
        int window = Math.max(limit * 3, 10);
        List<ScoredSkill> keyword = call("keywordSearch", key,
                () -> store.keywordSearch(request.query(), filter, window));
        List<ScoredSkill> similar = call("similaritySearch", key,
                () -> store.similaritySearch(request.query(), filter, window));

        Map<String, SkillSummary> fused = new HashMap<>();
        mergeNormalized(fused, keyword);
        mergeNormalized(fused, similar);

        List<SkillSummary> ranked = new ArrayList<>(fused.values());
        ranked.sort(RANKING);
        log.debug("Search '{}' {}: keyword={} similarity={} fused={}",
                request.query(), filter, keyword.size(), similar.size(), ranked.size());
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : ranked;
    }

    /**
     * All skills of one domain, highest rating first. An unknown domain yields
     * an empty list.
     */
    public List<SkillSummary> listByDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new ValidationException("listByDomain", "domain=" + domain, "domain must not be blank");
        }
        SkillFilter filter = SkillFilter.domain(domain);
        return call("listByDomain", "domain=" + filter.domain(),
                () -> store.list(filter, Integer.MAX_VALUE))
                .stream()
                .sorted(Comparator.comparingDouble(SkillMetadata::rating).reversed()
                        .thenComparing(SkillMetadata::skillId))
                .map(s -> s.toSummary(1.0))
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void mergeNormalized(Map<String, SkillSummary> fused, List<ScoredSkill> hits) {
        double top = hits.stream().mapToDouble(ScoredSkill::score).max().orElse(0);
        if (top <= 0) return;
        for (ScoredSkill hit : hits) {
            double normalized = hit.score() / top;
            fused.merge(hit.metadata().skillId(), hit.metadata().toSummary(normalized),
                    (a, b) -> a.score() >= b.score() ? a : b);
        }
    }

    private <T> T call(String operation, String key, Supplier<T> action) {
        try {
            return retry.call(operation, action);
        } catch (StoreUnavailableException e) {
            throw new SearchUnavailableException(operation, key, e.getReason(), e);
        }
    }
}
