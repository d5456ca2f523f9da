package com.skillforge.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One record of the File Store: a single text file belonging to a skill.
 *
 * Identified by {@code skillId} + {@code filePath} (the path relative to the
 * skill root; equal to {@code fileName} for top-level files) within one
 * ingestion {@code revision}.
 */
public record SkillFile(
        String  skillId,
        String  fileName,
        String  filePath,
        String  fileType,
        String  fileContent,
        long    fileSizeBytes,
        Instant createdAt,
        String  revision
) {

    public SkillFile {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(fileName, "fileName");
        if (filePath == null || filePath.isBlank()) {
            filePath = fileName;
        }
        filePath = filePath.replace('\\', '/');
        if (fileType == null || fileType.isBlank()) {
            fileType = typeOf(fileName);
        }
        if (fileContent == null) {
            fileContent = "";
        }
    }

    /** Extension without the dot, or {@code unknown}. */
    public static String typeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : "unknown";
    }

    /** Store document id: unique per skill, revision and relative path. */
    public String documentId() {
        return skillId + "_" + revision + "_" + filePath;
    }
}
