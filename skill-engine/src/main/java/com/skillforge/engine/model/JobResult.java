package com.skillforge.engine.model;

import java.util.List;

/**
 * Final summary of a lifecycle job.
 *
 * {@code skillsDeleted} is only populated by teardown (the skill ids that
 * existed before the stores were dropped); {@code failures} only by the
 * ingesting operations.
 */
public record JobResult(
        List<String>           storesCreated,
        List<String>           storesDeleted,
        List<String>           skillsCreated,
        List<String>           skillsDeleted,
        int                    filesIndexed,
        List<IngestionFailure> failures,
        String                 message
) {

    public JobResult {
        storesCreated = List.copyOf(storesCreated);
        storesDeleted = List.copyOf(storesDeleted);
        skillsCreated = List.copyOf(skillsCreated);
        skillsDeleted = List.copyOf(skillsDeleted);
        failures      = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
