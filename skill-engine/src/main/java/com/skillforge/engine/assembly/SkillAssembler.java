package com.skillforge.engine.assembly;

import com.skillforge.engine.model.SkillBundle;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import com.skillforge.engine.spec.SkillSpecification;
import com.skillforge.engine.spec.SkillSpecificationParser;
import com.skillforge.engine.store.SkillStore;
import com.skillforge.engine.store.StoreRetry;
import com.skillforge.engine.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the two-store join: one metadata record plus every file record of the
 * same skill, reassembled into a {@link SkillBundle}.
 *
 * <p>Snapshot consistency is achieved by version stamping. Ingestion writes
 * the files first and the metadata last, all with the same revision, and the
 * metadata records how many files that revision has. The assembler reads
 * metadata, then files, then metadata again, and keeps only the files of the
 * final revision. The bundle is accepted only if both metadata reads agree
 * and the kept files number exactly the recorded count. A mismatch means a
 * re-ingestion raced with this read, so the join is retried once before
 * failing.
 */
@Component
public class SkillAssembler {

    private static final Logger log = LoggerFactory.getLogger(SkillAssembler.class);

    static final String EMPTY_FILE_SET_WARNING = "skill has no files; metadata-only skill";

    private final SkillStore               store;
    private final StoreRetry               retry;
    private final SkillSpecificationParser parser;

    public SkillAssembler(SkillStore store, StoreRetry retry, SkillSpecificationParser parser) {
        this.store  = store;
        this.retry  = retry;
        this.parser = parser;
    }

    /**
     * @throws SkillNotFoundException     if no metadata record exists
     * @throws StoreUnavailableException  if the store is unreachable or the snapshot stayed inconsistent
     */
    public SkillBundle assemble(String skillId) {
        Optional<SkillBundle> first = tryAssemble(skillId);
        if (first.isPresent()) return first.get();

        log.warn("Skill '{}' changed during assembly, retrying once", skillId);
        return tryAssemble(skillId).orElseThrow(() -> new StoreUnavailableException(
                "assemble", "skill_id=" + skillId,
                "inconsistent snapshot: skill was re-ingested during both assembly attempts"));
    }

    /** Metadata only; never touches the File Store. */
    public SkillMetadata metadataOnly(String skillId) {
        return readMetadata("getMetadata", skillId);
    }

    /** The file records of a skill, after confirming the skill exists. */
    public List<SkillFile> files(String skillId) {
        return assemble(skillId).files();
    }

    // ------------------------------------------------------------------
    // Join
    // ------------------------------------------------------------------

    /** @return empty when the revision check failed */
    private Optional<SkillBundle> tryAssemble(String skillId) {
        SkillMetadata before = readMetadata("assemble", skillId);
        List<SkillFile> stored = retry.call("getFiles", () -> store.findFiles(skillId));
        SkillMetadata after = readMetadata("assemble", skillId);

        String revision = after.revision();
        if (!Objects.equals(before.revision(), revision)) {
            return Optional.empty();
        }
        List<SkillFile> files = stored.stream()
                .filter(f -> Objects.equals(f.revision(), revision))
                .toList();
        if (after.fileCount() >= 0 ? files.size() != after.fileCount() : files.size() != stored.size()) {
            log.debug("Skill '{}' revision {}: expected {} files, found {} of {}",
                    skillId, revision, after.fileCount(), files.size(), stored.size());
            return Optional.empty();
        }

        List<String> warnings = new ArrayList<>();
        if (files.isEmpty()) {
            log.warn("Skill '{}' has no files", skillId);
            warnings.add(EMPTY_FILE_SET_WARNING);
        }

        Optional<SkillFile> specFile = files.stream()
                .filter(f -> f.fileName().equalsIgnoreCase(SkillSpecificationParser.SPECIFICATION_FILE))
                .min((a, b) -> Integer.compare(a.filePath().length(), b.filePath().length()));

        String specText = specFile.map(SkillFile::fileContent).orElse("");
        SkillSpecification specification = specFile
                .map(f -> parser.parse(f.fileContent(), skillId))
                .orElse(null);
        if (specFile.isEmpty() && !files.isEmpty()) {
            warnings.add("skill has no " + SkillSpecificationParser.SPECIFICATION_FILE);
        }

        return Optional.of(new SkillBundle(after, files, specText, specification, warnings));
    }

    private SkillMetadata readMetadata(String operation, String skillId) {
        return retry.call(operation, () -> store.findMetadata(skillId))
                .orElseThrow(() -> new SkillNotFoundException(operation, skillId));
    }
}
