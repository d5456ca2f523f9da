package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.ingest.IngestedSkill;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestFolderResponse(String skillId, int documentsIndexed, int filesIndexed, List<String> files) {

    public static IngestFolderResponse from(IngestedSkill s) {
        return new IngestFolderResponse(s.skillId(), s.documentsIndexed(), s.filesIndexed(), s.files());
    }
}
