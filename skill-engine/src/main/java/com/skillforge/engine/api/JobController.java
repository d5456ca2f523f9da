package com.skillforge.engine.api;

import com.skillforge.engine.api.dto.JobResponse;
import com.skillforge.engine.api.dto.SubmitJobRequest;
import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.job.JobPoller;
import com.skillforge.engine.job.WorkflowOrchestrator;
import com.skillforge.engine.model.Job;
import com.skillforge.engine.model.JobOperation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST API for lifecycle jobs.
 *
 * POST   /api/v1/jobs                         — submit {operation, params}
 * POST   /api/v1/ops/{operation}              — shorthand: params in the body
 * GET    /api/v1/jobs                         — all retained jobs, newest first
 * GET    /api/v1/jobs/{id}                    — poll
 * GET    /api/v1/jobs/{id}/await              — poll on an interval until finished or attempts run out
 * DELETE /api/v1/jobs/{id}                    — purge a finished job
 * DELETE /api/v1/jobs?finished=true           — purge every finished job
 */
@RestController
@RequestMapping("/api/v1")
public class JobController {

    static final long MAX_INTERVAL_MS   = 60_000;
    static final int  MAX_ATTEMPTS      = 600;
    static final long MAX_TOTAL_WAIT_MS = 300_000;

    private final WorkflowOrchestrator orchestrator;
    private final JobPoller            poller;

    public JobController(WorkflowOrchestrator orchestrator, JobPoller poller) {
        this.orchestrator = orchestrator;
        this.poller       = poller;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"operation":"setup","params":{"recreate":true}}'
     */
    @PostMapping("/jobs")
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        return accepted(orchestrator.submit(operation(req.operation()), req.params()));
    }

    @PostMapping("/ops/{operation}")
    public ResponseEntity<JobResponse> submitOperation(@PathVariable String operation,
                                                       @RequestBody(required = false) Map<String, Object> params) {
        return accepted(orchestrator.submit(operation(operation), params));
    }

    @GetMapping("/jobs")
    public List<JobResponse> list() {
        return orchestrator.list().stream().map(JobResponse::from).toList();
    }

    @GetMapping("/jobs/{jobId}")
    public JobResponse poll(@PathVariable String jobId) {
        return JobResponse.from(orchestrator.poll(jobId));
    }

    /**
     * HTTP 200 — the job finished within the polling budget
     * HTTP 202 — the caller gave up waiting; the job is still running
     * HTTP 400 — interval or attempts out of range, or a total wait above five minutes
     */
    @GetMapping("/jobs/{jobId}/await")
    public ResponseEntity<JobResponse> await(@PathVariable String jobId,
                                             @RequestParam(defaultValue = "1000") long intervalMs,
                                             @RequestParam(defaultValue = "30") int maxAttempts) {
        checkAwaitBudget(jobId, intervalMs, maxAttempts);
        JobPoller.Outcome outcome = poller.await(jobId, Duration.ofMillis(intervalMs), maxAttempts);
        JobResponse body = JobResponse.from(outcome.job());
        return outcome.timedOut() ? ResponseEntity.accepted().body(body) : ResponseEntity.ok(body);
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> purge(@PathVariable String jobId) {
        orchestrator.purge(jobId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/jobs")
    public Map<String, Integer> purgeFinished(@RequestParam(defaultValue = "true") boolean finished) {
        return Map.of("purged", finished ? orchestrator.purgeFinished() : 0);
    }

    private static void checkAwaitBudget(String jobId, long intervalMs, int maxAttempts) {
        String key = "job_id=" + jobId;
        if (intervalMs <= 0 || intervalMs > MAX_INTERVAL_MS) {
            throw new ValidationException("awaitJob", key,
                    "intervalMs must be in 1.." + MAX_INTERVAL_MS + ", got " + intervalMs);
        }
        if (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS) {
            throw new ValidationException("awaitJob", key,
                    "maxAttempts must be in 1.." + MAX_ATTEMPTS + ", got " + maxAttempts);
        }
        if (intervalMs * (maxAttempts - 1) > MAX_TOTAL_WAIT_MS) {
            throw new ValidationException("awaitJob", key,
                    "intervalMs * (maxAttempts - 1) must not exceed " + MAX_TOTAL_WAIT_MS + " ms");
        }
    }

    private static ResponseEntity<JobResponse> accepted(Job job) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
    }

    private static JobOperation operation(String value) {
        return JobOperation.fromWire(value).orElseThrow(() -> new ValidationException(
                "submitJob", "operation=" + value, "operation must be one of setup, teardown, update-skills"));
    }
}
