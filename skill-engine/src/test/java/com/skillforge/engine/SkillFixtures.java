package com.skillforge.engine;

import com.skillforge.engine.ingest.IngestionService;
import com.skillforge.engine.ingest.SkillDirectoryReader;
import com.skillforge.engine.spec.SkillSpecificationParser;
import com.skillforge.engine.store.InMemorySkillStore;
import com.skillforge.engine.store.SkillStore;
import com.skillforge.engine.store.StoreRetry;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Access to the sample skills under src/test/resources/skills:
 * verify-expense-policy (finance), adjudicate-storm-claim (insurance),
 * analyze-customer-churn (marketing), calculate-break-even (operations,
 * no front matter), write-incident-postmortem (reference only) and
 * plan-fleet-maintenance (parameter groups).
 */
public final class SkillFixtures {

    public static final int SKILL_COUNT = 6;

    private SkillFixtures() {}

    public static Path root() {
        URL url = SkillFixtures.class.getResource("/skills");
        if (url == null) throw new IllegalStateException("test resources missing /skills");
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static StoreRetry noBackoffRetry() {
        return new StoreRetry(3, Duration.ZERO);
    }

    public static IngestionService ingestion(SkillStore store) {
        return new IngestionService(store, noBackoffRetry(),
                new SkillDirectoryReader(new SkillSpecificationParser()),
                Clock.systemUTC(), root().toString(), root().toString());
    }

    /** A fresh in-memory store holding every sample skill. */
    public static InMemorySkillStore loadedStore() {
        InMemorySkillStore store = new InMemorySkillStore("agent_skills", "agent_skill_files");
        store.ensureStores();
        ingestion(store).ingestAll(root(), line -> {});
        return store;
    }
}
