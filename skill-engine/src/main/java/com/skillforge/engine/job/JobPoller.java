package com.skillforge.engine.job;

import com.skillforge.engine.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Caller-side polling: poll on a fixed interval up to a maximum number of
 * attempts, then give up. Giving up is the caller's timeout only; the job
 * itself keeps running.
 */
@Component
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final WorkflowOrchestrator orchestrator;

    public JobPoller(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** Result of waiting: the last observed job and whether the caller gave up first. */
    public record Outcome(Job job, boolean timedOut, int attempts) {}

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public Outcome await(String jobId, Duration interval, int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        Job job = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            job = orchestrator.poll(jobId);
            if (job.getStatus().isTerminal()) {
                return new Outcome(job, false, attempt);
            }
            if (attempt < attempts && !sleep(interval)) {
                break;
            }
        }
        log.info("Gave up waiting for job {} after {} attempts; it is still {}",
                jobId, attempts, job.getStatus().name().toLowerCase(Locale.ROOT));
        return new Outcome(job, true, attempts);
    }

    private static boolean sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
