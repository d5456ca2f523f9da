package com.skillforge.engine.store;

import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySkillStoreTest {

    InMemorySkillStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySkillStore("agent_skills", "agent_skill_files");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void ensureStores_reportsCreationOnlyOnce() {
        assertThat(store.storesExist()).isFalse();
        assertThat(store.ensureStores()).containsExactly("agent_skills", "agent_skill_files");
        assertThat(store.ensureStores()).isEmpty();
        assertThat(store.storesExist()).isTrue();
    }

    @Test
    void deleteStores_neverCreated_deletesNothing() {
        assertThat(store.deleteStores()).isEmpty();
        assertThat(store.listSkillIds()).isEmpty();
    }

    @Test
    void deleteStores_dropsEveryRecord() {
        store.upsertSkill(skill("a", "finance", 4.0, List.of()), List.of(file("a", "SKILL.md", "r1")));

        assertThat(store.deleteStores()).containsExactly("agent_skills", "agent_skill_files");
        assertThat(store.findMetadata("a")).isEmpty();
        assertThat(store.findFiles("a")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Test
    void upsertSkill_replacesWholeFileSet() {
        store.upsertSkill(skill("a", "finance", 4.0, List.of()),
                List.of(file("a", "SKILL.md", "r1"), file("a", "old.py", "r1")));
        store.upsertSkill(skill("a", "finance", 4.0, List.of()),
                List.of(file("a", "SKILL.md", "r2")));

        assertThat(store.findFiles("a")).extracting(SkillFile::filePath).containsExactly("SKILL.md");
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void keywordSearch_namesOutweighDescriptions() {
        store.upsertSkill(meta("claims", "Adjudicate Storm Claim", "insurance decisions"), List.of());
        store.upsertSkill(meta("weather", "Forecast Weather", "predicts storm tracks"), List.of());

        List<ScoredSkill> hits = store.keywordSearch("storm", SkillFilter.NONE, 10);

        assertThat(hits).extracting(h -> h.metadata().skillId()).containsExactly("claims", "weather");
        assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }

    @Test
    void similaritySearch_unrelatedQuery_returnsNothing() {
        store.upsertSkill(meta("claims", "Adjudicate Storm Claim", "insurance decisions"), List.of());

        assertThat(store.similaritySearch("quarterly payroll", SkillFilter.NONE, 10)).isEmpty();
    }

    @Test
    void list_filtersByTagsAndSortsByRating() {
        store.upsertSkill(skill("a", "finance", 3.0, List.of("expense", "audit")), List.of());
        store.upsertSkill(skill("b", "finance", 4.5, List.of("expense")), List.of());
        store.upsertSkill(skill("c", "hr", 5.0, List.of("audit")), List.of());

        assertThat(store.list(SkillFilter.of(null, List.of("EXPENSE", "audit"), true), 10))
                .extracting(SkillMetadata::skillId).containsExactly("a");
        assertThat(store.list(SkillFilter.of(null, List.of("expense", "audit"), false), 10))
                .extracting(SkillMetadata::skillId).containsExactly("c", "b", "a");
        assertThat(store.list(SkillFilter.domain("Finance"), 1))
                .extracting(SkillMetadata::skillId).containsExactly("b");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static SkillMetadata skill(String id, String domain, double rating, List<String> tags) {
        return new SkillMetadata(id, id, "", null, domain, tags, "system", "1.0", rating,
                0, 1.0, null, 0, "r1", Instant.EPOCH, Instant.EPOCH);
    }

    static SkillMetadata meta(String id, String name, String description) {
        return new SkillMetadata(id, name, description, null, "general", List.of(), "system", "1.0", 5.0,
                0, 1.0, null, 0, "r1", Instant.EPOCH, Instant.EPOCH);
    }

    static SkillFile file(String skillId, String path, String revision) {
        return new SkillFile(skillId, path, path, null, "content", 7, Instant.EPOCH, revision);
    }
}
