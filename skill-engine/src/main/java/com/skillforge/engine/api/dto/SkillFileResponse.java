package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.model.SkillFile;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SkillFileResponse(
        String fileName,
        String filePath,
        String fileType,
        String fileContent,
        long   fileSizeBytes
) {
    public static SkillFileResponse from(SkillFile f) {
        return new SkillFileResponse(f.fileName(), f.filePath(), f.fileType(), f.fileContent(), f.fileSizeBytes());
    }
}
