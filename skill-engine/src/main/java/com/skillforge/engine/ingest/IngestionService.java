package com.skillforge.engine.ingest;

import com.skillforge.engine.error.SkillEngineException;
import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.model.IngestionFailure;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import com.skillforge.engine.store.SkillStore;
import com.skillforge.engine.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * The only write path into the Record Stores.
 *
 * A skill is always replaced whole: a new revision stamp is minted, the
 * complete file set and then the metadata record are written under it.
 * Re-ingesting a directory is therefore idempotent and leaves no stale files.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final SkillStore           store;
    private final StoreRetry           retry;
    private final SkillDirectoryReader reader;
    private final Clock                clock;
    private final Path                 skillsRoot;
    private final Path                 incomingRoot;

    public IngestionService(SkillStore store,
                            StoreRetry retry,
                            SkillDirectoryReader reader,
                            Clock clock,
                            @Value("${skillforge.skills.root:skills}") String skillsRoot,
                            @Value("${skillforge.skills.incoming-root:skills-incoming}") String incomingRoot) {
        this.store        = store;
        this.retry        = retry;
        this.reader       = reader;
        this.clock        = clock;
        this.skillsRoot   = Paths.get(skillsRoot).toAbsolutePath().normalize();
        this.incomingRoot = Paths.get(incomingRoot).toAbsolutePath().normalize();
    }

    public Path skillsRoot()   { return skillsRoot; }
    public Path incomingRoot() { return incomingRoot; }

    // ------------------------------------------------------------------
    // Bulk
    // ------------------------------------------------------------------

    /**
     * Ingests every skill directory directly under {@code root}. A failure in
     * one skill is recorded and the next skill is ingested.
     *
     * @param progress receives one human-readable line per skill
     * @throws ValidationException if {@code root} is not a directory
     */
    public IngestionReport ingestAll(Path root, Consumer<String> progress) {
        if (!Files.isDirectory(root)) {
            throw new ValidationException("ingest", "root=" + root, "skills directory does not exist");
        }
        List<Path> dirs = skillDirectories(root);
        log.info("Ingesting {} skill directories from {}", dirs.size(), root);

        List<String> ingested = new ArrayList<>();
        List<IngestionFailure> failures = new ArrayList<>();
        int files = 0;
        int n = 0;
        for (Path dir : dirs) {
            n++;
            String name = dir.getFileName().toString();
            progress.accept("Ingesting skill " + n + "/" + dirs.size() + ": " + name);
            try {
                IngestedSkill skill = ingestDirectory(dir);
                ingested.add(skill.skillId());
                files += skill.filesIndexed();
            } catch (SkillEngineException | UncheckedIOException e) {
                log.warn("Failed to ingest skill directory '{}': {}", name, e.getMessage());
                failures.add(new IngestionFailure(name, e.getMessage()));
            }
        }
        log.info("Ingested {} skills ({} files), {} failed", ingested.size(), files, failures.size());
        return new IngestionReport(ingested, files, failures);
    }

    // ------------------------------------------------------------------
    // Single skill
    // ------------------------------------------------------------------

    /**
     * Synchronously ingests one folder under the skills root.
     *
     * @throws ValidationException if the folder name is unsafe or no such folder exists
     */
    public IngestedSkill ingestFolder(String folderName) {
        Path dir = resolveChild(skillsRoot, folderName, "ingestFolder");
        if (!Files.isDirectory(dir)) {
            throw new ValidationException("ingestFolder", "folder=" + folderName,
                    "no skill folder '" + folderName + "' under " + skillsRoot);
        }
        return ingestDirectory(dir);
    }

    /** Reads and writes one skill directory as a whole-skill replace. */
    public IngestedSkill ingestDirectory(Path dir) {
        String revision = UUID.randomUUID().toString();
        SkillDirectoryReader.ReadSkill read = reader.read(dir, revision, clock.instant());

        String skillId = read.metadata().skillId();
        SkillMetadata metadata = retry.call("getMetadata", () -> store.findMetadata(skillId))
                .map(previous -> carryOver(read.metadata(), previous))
                .orElse(read.metadata());

        retry.run("upsertSkill", () -> store.upsertSkill(metadata, read.files()));
        log.info("Indexed skill '{}' ({} files, revision {})", skillId, read.files().size(), revision);
        return new IngestedSkill(skillId, 1, read.files().size(),
                read.files().stream().map(SkillFile::filePath).toList());
    }

    /** Re-ingestion keeps the original creation time and the usage counters. */
    private static SkillMetadata carryOver(SkillMetadata fresh, SkillMetadata previous) {
        return new SkillMetadata(
                fresh.skillId(), fresh.name(), fresh.description(), fresh.shortDescription(),
                fresh.domain(), fresh.tags(), fresh.author(), fresh.version(), fresh.rating(),
                previous.usageCount(), previous.successRate(), fresh.searchableText(),
                fresh.fileCount(), fresh.revision(),
                previous.createdAt() == null ? fresh.createdAt() : previous.createdAt(),
                fresh.updatedAt());
    }

    /**
     * Resolves {@code relative} under {@code root}, rejecting anything that
     * would leave it.
     */
    public Path resolveChild(Path root, String relative, String operation) {
        if (relative == null || relative.isBlank()) {
            throw new ValidationException(operation, "folder=" + relative, "folder name must not be blank");
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new ValidationException(operation, "folder=" + relative, "folder must stay under " + root);
        }
        return resolved;
    }

    private static List<Path> skillDirectories(Path root) {
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> !p.getFileName().toString().equals("__pycache__"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + root, e);
        }
    }
}
