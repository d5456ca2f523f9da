package com.skillforge.engine.store;

import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Process-local Record Stores for local development and tests.
 *
 * Each skill's file set is held as one immutable list and replaced in a
 * single map write, so a reader sees either the old or the new file set and
 * never a mix. Not durable: everything is lost on restart.
 */
public class InMemorySkillStore implements SkillStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySkillStore.class);

    private static final Comparator<ScoredSkill> BY_SCORE = Comparator
            .comparingDouble(ScoredSkill::score).reversed()
            .thenComparing(s -> s.metadata().skillId());

    private final Map<String, SkillMetadata>   metadata = new ConcurrentHashMap<>();
    private final Map<String, List<SkillFile>> files    = new ConcurrentHashMap<>();

    private final String metadataStoreName;
    private final String fileStoreName;

    private volatile boolean exists;

    public InMemorySkillStore(String metadataStoreName, String fileStoreName) {
        this.metadataStoreName = metadataStoreName;
        this.fileStoreName     = fileStoreName;
    }

    @Override public String metadataStoreName() { return metadataStoreName; }
    @Override public String fileStoreName()     { return fileStoreName; }

    // ------------------------------------------------------------------
    // Store lifecycle
    // ------------------------------------------------------------------

    @Override
    public boolean storesExist() {
        return exists;
    }

    @Override
    public synchronized List<String> ensureStores() {
        if (exists) return List.of();
        exists = true;
        log.info("Created in-memory stores '{}' and '{}'", metadataStoreName, fileStoreName);
        return List.of(metadataStoreName, fileStoreName);
    }

    @Override
    public synchronized List<String> deleteStores() {
        if (!exists) return List.of();
        exists = false;
        metadata.clear();
        files.clear();
        return List.of(metadataStoreName, fileStoreName);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public void upsertSkill(SkillMetadata skill, List<SkillFile> skillFiles) {
        exists = true;
        files.put(skill.skillId(), List.copyOf(skillFiles));
        metadata.put(skill.skillId(), skill);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<SkillMetadata> findMetadata(String skillId) {
        return Optional.ofNullable(metadata.get(skillId));
    }

    @Override
    public List<SkillFile> findFiles(String skillId) {
        return files.getOrDefault(skillId, List.of());
    }

    @Override
    public List<String> listSkillIds() {
        return metadata.keySet().stream().sorted().toList();
    }

    @Override
    public List<ScoredSkill> keywordSearch(String query, SkillFilter filter, int limit) {
        return score(filter, limit, s -> TextScoring.keyword(query, s.name(), s.description()));
    }

    @Override
    public List<ScoredSkill> similaritySearch(String query, SkillFilter filter, int limit) {
        return score(filter, limit, s -> TextScoring.cosine(query, s.searchableText()));
    }

    @Override
    public List<SkillMetadata> list(SkillFilter filter, int limit) {
        return metadata.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparingDouble(SkillMetadata::rating).reversed()
                        .thenComparing(SkillMetadata::skillId))
                .limit(limit)
                .toList();
    }

    private List<ScoredSkill> score(SkillFilter filter, int limit, ToDoubleFunction<SkillMetadata> scorer) {
        List<ScoredSkill> hits = new ArrayList<>();
        for (SkillMetadata skill : metadata.values()) {
            if (!filter.matches(skill)) continue;
            double s = scorer.applyAsDouble(skill);
            if (s > 0) hits.add(new ScoredSkill(skill, s));
        }
        hits.sort(BY_SCORE);
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }
}
