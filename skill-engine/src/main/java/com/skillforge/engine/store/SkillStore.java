package com.skillforge.engine.store;

import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;

import java.util.List;
import java.util.Optional;

/**
 * The two Record Stores: the Metadata Store (one record per skill) and the
 * File Store (one record per skill file).
 *
 * Reads never fail because a store was never created: they return empty
 * results. Every method throws {@link StoreUnavailableException} when the
 * backing engine cannot be reached.
 */
public interface SkillStore {

    String metadataStoreName();

    String fileStoreName();

    // ------------------------------------------------------------------
    // Store lifecycle
    // ------------------------------------------------------------------

    boolean storesExist();

    /** Creates whichever stores are absent. @return names of the stores actually created */
    List<String> ensureStores();

    /** Drops whichever stores exist. @return names of the stores actually deleted */
    List<String> deleteStores();

    // ------------------------------------------------------------------
    // Writes (ingestion path only)
    // ------------------------------------------------------------------

    /**
     * Replaces the skill in place: its File Store records become exactly
     * {@code files} and its Metadata Store record becomes {@code metadata}.
     * Files are written before metadata, so a reader that sees the new
     * metadata revision can also see the matching files. Files of an older
     * revision may stay visible until the metadata has switched; readers
     * keep only the files whose revision matches the metadata.
     */
    void upsertSkill(SkillMetadata metadata, List<SkillFile> files);

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    Optional<SkillMetadata> findMetadata(String skillId);

    /** Every file record of the skill, whatever its revision. */
    List<SkillFile> findFiles(String skillId);

    /** Every skill id in the Metadata Store; empty when the store does not exist. */
    List<String> listSkillIds();

    /** Full-text match of {@code query} against name and description. Scores are engine-relative. */
    List<ScoredSkill> keywordSearch(String query, SkillFilter filter, int limit);

    /** Meaning-based match of {@code query} against the searchable text. Scores are engine-relative. */
    List<ScoredSkill> similaritySearch(String query, SkillFilter filter, int limit);

    /** Filter-only browse, highest rating first; {@code Integer.MAX_VALUE} lists every match. */
    List<SkillMetadata> list(SkillFilter filter, int limit);
}
