package com.skillforge.engine.ingest;

import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import com.skillforge.engine.spec.SkillSpecification;
import com.skillforge.engine.spec.SkillSpecificationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads one skill directory into a metadata record and its file records.
 *
 * Compiled caches, build output, VCS metadata, hidden files and anything that
 * is not valid UTF-8 text are never turned into records.
 */
@Component
public class SkillDirectoryReader {

    private static final Logger log = LoggerFactory.getLogger(SkillDirectoryReader.class);

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of("__pycache__", "target", ".git", "node_modules");
    private static final Set<String> EXCLUDED_EXTENSIONS  = Set.of("pyc", "pyo", "class", "jar");

    static final String DEFAULT_AUTHOR  = "system";
    static final String DEFAULT_VERSION = "1.0";
    static final double DEFAULT_RATING  = 5.0;

    private final SkillSpecificationParser parser;

    public SkillDirectoryReader(SkillSpecificationParser parser) {
        this.parser = parser;
    }

    /** One directory read into records, before it is written. */
    public record ReadSkill(SkillMetadata metadata, List<SkillFile> files) {}

    /**
     * @param revision stamp written on the metadata and on every file
     * @throws ValidationException if the directory has no SKILL.md or the SKILL.md is malformed
     */
    public ReadSkill read(Path skillDir, String revision, Instant now) {
        String dirName = skillDir.getFileName().toString();
        List<Path> paths = listFiles(skillDir);

        Path specPath = paths.stream()
                .filter(p -> p.getParent().equals(skillDir))
                .filter(p -> p.getFileName().toString().equalsIgnoreCase(SkillSpecificationParser.SPECIFICATION_FILE))
                .findFirst()
                .orElseThrow(() -> new ValidationException("ingest", "skill_id=" + dirName,
                        SkillSpecificationParser.SPECIFICATION_FILE + " not found in " + skillDir));

        String specText = readText(specPath);
        if (specText == null) {
            throw new ValidationException("ingest", "skill_id=" + dirName,
                    SkillSpecificationParser.SPECIFICATION_FILE + " is not valid UTF-8");
        }
        SkillSpecification spec = parser.parse(specText, dirName);
        String skillId = spec.skillId();

        List<SkillFile> files = new ArrayList<>();
        for (Path p : paths) {
            String content = p.equals(specPath) ? specText : readText(p);
            if (content == null) {
                log.debug("Skipping non-text file {}", p);
                continue;
            }
            String relative = skillDir.relativize(p).toString().replace('\\', '/');
            files.add(new SkillFile(skillId, p.getFileName().toString(), relative, null, content,
                    content.getBytes(StandardCharsets.UTF_8).length, now, revision));
        }

        SkillMetadata metadata = new SkillMetadata(
                skillId,
                spec.name(),
                spec.description(),
                null,
                spec.domain(),
                spec.tags(),
                spec.author() == null ? DEFAULT_AUTHOR : spec.author(),
                spec.version() == null ? DEFAULT_VERSION : spec.version(),
                spec.rating() == null ? DEFAULT_RATING : spec.rating(),
                0,
                1.0,
                null,
                files.size(),
                revision,
                now,
                now);
        return new ReadSkill(metadata, files);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Path> listFiles(Path skillDir) {
        try (Stream<Path> walk = Files.walk(skillDir)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(skillDir.relativize(p)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + skillDir, e);
        }
    }

    static boolean isExcluded(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || EXCLUDED_DIRECTORIES.contains(name)) {
                return true;
            }
        }
        String fileName = relative.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && EXCLUDED_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /** @return the file as text, or null if it is not valid UTF-8 */
    private static String readText(Path file) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }
}
