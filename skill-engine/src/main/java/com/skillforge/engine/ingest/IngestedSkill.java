package com.skillforge.engine.ingest;

import java.util.List;

/** Outcome of ingesting a single skill directory. */
public record IngestedSkill(String skillId, int documentsIndexed, int filesIndexed, List<String> files) {

    public IngestedSkill {
        files = List.copyOf(files);
    }
}
