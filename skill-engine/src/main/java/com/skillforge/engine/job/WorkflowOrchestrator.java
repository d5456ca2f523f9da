package com.skillforge.engine.job;

import com.skillforge.engine.error.SkillEngineException;
import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.ingest.IngestedSkill;
import com.skillforge.engine.ingest.IngestionReport;
import com.skillforge.engine.ingest.IngestionService;
import com.skillforge.engine.model.IngestionFailure;
import com.skillforge.engine.model.Job;
import com.skillforge.engine.model.JobOperation;
import com.skillforge.engine.model.JobResult;
import com.skillforge.engine.store.SkillStore;
import com.skillforge.engine.store.StoreRetry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Runs lifecycle jobs (setup, teardown, update-skills) in the background.
 *
 * {@link #submit} registers the job and returns immediately; the work runs
 * on a fixed worker pool so at most {@code skillforge.jobs.workers} jobs
 * touch the stores at once. Callers poll; the job keeps running server-side
 * regardless of whether anyone is still polling.
 *
 * Per-skill ingestion failures are recorded in the job result and never fail
 * the job. A job fails only when its precondition is unmet (missing skills
 * folder) or the stores are unreachable.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final JobRegistry      jobs;
    private final SkillStore       store;
    private final StoreRetry       retry;
    private final IngestionService ingestion;
    private final Clock            clock;
    private final MeterRegistry    meterRegistry;
    private final ExecutorService  workers;

    public WorkflowOrchestrator(JobRegistry jobs,
                                SkillStore store,
                                StoreRetry retry,
                                IngestionService ingestion,
                                Clock clock,
                                MeterRegistry meterRegistry,
                                @Value("${skillforge.jobs.workers:2}") int workerCount) {
        this.jobs          = jobs;
        this.store         = store;
        this.retry         = retry;
        this.ingestion     = ingestion;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.workers       = Executors.newFixedThreadPool(workerCount);
    }

    // ------------------------------------------------------------------
    // Submission and polling
    // ------------------------------------------------------------------

    public Job submit(JobOperation operation, Map<String, Object> params) {
        String jobId = UUID.randomUUID().toString().substring(0, 8);
        Job job = new Job(jobId, operation, params, clock.instant());
        jobs.put(job);
        log.info("Submitted job {} ({}) params={}", jobId, operation.wireName(), job.getParams());
        workers.submit(() -> run(job));
        return job;
    }

    /** Non-blocking status read. */
    public Job poll(String jobId) {
        return jobs.find(jobId).orElseThrow(() -> new JobNotFoundException("pollJob", jobId));
    }

    public List<Job> list() {
        return jobs.all();
    }

    /** Removes a finished job. A job still pending or running cannot be purged. */
    public void purge(String jobId) {
        Job job = jobs.find(jobId).orElseThrow(() -> new JobNotFoundException("purgeJob", jobId));
        if (!job.getStatus().isTerminal()) {
            throw new ValidationException("purgeJob", "job_id=" + jobId,
                    "job is still " + job.getStatus().name().toLowerCase(Locale.ROOT));
        }
        jobs.remove(jobId);
    }

    /** @return number of finished jobs removed */
    public int purgeFinished() {
        int removed = 0;
        for (Job job : jobs.all()) {
            if (job.getStatus().isTerminal() && jobs.remove(job.getJobId())) removed++;
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Execution (worker thread)
    // ------------------------------------------------------------------

    void run(Job job) {
        MDC.put("jobId", job.getJobId());
        Timer.Sample sample = Timer.start(meterRegistry);
        job.markRunning(clock.instant());
        log.info("Job {} running ({})", job.getJobId(), job.getOperation().wireName());
        try {
            JobResult result = switch (job.getOperation()) {
                case SETUP         -> setup(job);
                case TEARDOWN      -> teardown(job);
                case UPDATE_SKILLS -> updateSkills(job);
            };
            job.complete(result, clock.instant());
            log.info("Job {} completed: {}", job.getJobId(), result.message());
        } catch (SkillEngineException e) {
            log.error("Job {} failed: {}", job.getJobId(), e.getMessage());
            job.fail(e.getMessage(), null, clock.instant());
        } catch (RuntimeException e) {
            log.error("Unhandled error in job {}: {}", job.getJobId(), e.getMessage(), e);
            job.fail("Unhandled exception: " + e.getMessage(), null, clock.instant());
        } finally {
            sample.stop(meterRegistry.timer("skillforge.job.duration",
                    "operation", job.getOperation().wireName(),
                    "status", job.getStatus().name().toLowerCase(Locale.ROOT)));
            MDC.remove("jobId");
        }
    }

    private JobResult setup(Job job) {
        Path root = ingestion.skillsRoot();
        if (!Files.isDirectory(root)) {
            throw new ValidationException("setup", "job_id=" + job.getJobId(),
                    "skills directory " + root + " does not exist");
        }

        List<String> deleted = List.of();
        if (flag(job.getParams().get("recreate"))) {
            progress(job, "Deleting existing stores...");
            deleted = retry.call("deleteStores", store::deleteStores);
        }
        progress(job, "Creating index '" + store.metadataStoreName() + "' and '" + store.fileStoreName() + "'...");
        List<String> created = retry.call("ensureStores", store::ensureStores);

        IngestionReport report = ingestion.ingestAll(root, line -> progress(job, line));
        String message = "Setup complete: " + report.skillIds().size() + " skills indexed ("
                + report.filesIndexed() + " files)"
                + (report.failures().isEmpty() ? "" : ", " + report.failures().size() + " failed");
        return new JobResult(created, deleted, report.skillIds(), List.of(),
                report.filesIndexed(), report.failures(), message);
    }

    private JobResult teardown(Job job) {
        progress(job, "Enumerating skills...");
        List<String> existing = retry.call("listSkills", store::listSkillIds);

        progress(job, "Deleting stores...");
        List<String> deleted = retry.call("deleteStores", store::deleteStores);

        String message = deleted.isEmpty()
                ? "Nothing to tear down: stores did not exist"
                : "Teardown complete: deleted " + existing.size() + " skills and stores " + deleted;
        return new JobResult(List.of(), deleted, List.of(), existing, 0, List.of(), message);
    }

    private JobResult updateSkills(Job job) {
        Object folderParam = job.getParams().get("folder");
        Path folder = folderParam == null || folderParam.toString().isBlank()
                ? ingestion.incomingRoot()
                : ingestion.resolveChild(ingestion.incomingRoot(), folderParam.toString(), "updateSkills");
        if (!Files.isDirectory(folder)) {
            throw new ValidationException("updateSkills", "job_id=" + job.getJobId(),
                    "update folder " + folder + " does not exist");
        }

        progress(job, "Ensuring stores exist...");
        List<String> created = retry.call("ensureStores", store::ensureStores);

        IngestionReport report = isSkillDirectory(folder)
                ? single(folder, job)
                : ingestion.ingestAll(folder, line -> progress(job, line));
        String message = "Update complete: " + report.skillIds().size() + " skills created or updated ("
                + report.filesIndexed() + " files)"
                + (report.failures().isEmpty() ? "" : ", " + report.failures().size() + " failed");
        return new JobResult(created, List.of(), report.skillIds(), List.of(),
                report.filesIndexed(), report.failures(), message);
    }

    private IngestionReport single(Path folder, Job job) {
        progress(job, "Ingesting skill " + folder.getFileName());
        try {
            IngestedSkill skill = ingestion.ingestDirectory(folder);
            return new IngestionReport(List.of(skill.skillId()), skill.filesIndexed(), List.of());
        } catch (SkillEngineException e) {
            log.warn("Failed to ingest '{}': {}", folder.getFileName(), e.getMessage());
            return new IngestionReport(List.of(), 0,
                    List.of(new IngestionFailure(folder.getFileName().toString(), e.getMessage())));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void progress(Job job, String line) {
        job.updateProgress(line, clock.instant());
        log.info("Job {}: {}", job.getJobId(), line);
    }

    private static boolean isSkillDirectory(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.anyMatch(p -> p.getFileName().toString().equalsIgnoreCase("SKILL.md"));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + dir, e);
        }
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
