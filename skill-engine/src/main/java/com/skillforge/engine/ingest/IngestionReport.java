package com.skillforge.engine.ingest;

import com.skillforge.engine.model.IngestionFailure;

import java.util.List;

/** Outcome of ingesting a directory of skill directories. */
public record IngestionReport(List<String> skillIds, int filesIndexed, List<IngestionFailure> failures) {

    public IngestionReport {
        skillIds = List.copyOf(skillIds);
        failures = List.copyOf(failures);
    }
}
