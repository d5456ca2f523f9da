package com.skillforge.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tracked lifecycle operation (setup, teardown, update-skills).
 *
 * Created by the orchestrator on submission and mutated only by the worker
 * that runs it; readers (pollers) see a consistent view through the
 * synchronized accessors. Retained in the job registry until purged.
 */
public class Job {

    private final String              jobId;
    private final JobOperation        operation;
    private final Map<String, Object> params;
    private final Instant             createdAt;

    private JobStatus status = JobStatus.PENDING;
    private String    progress;
    private String    message;
    private JobResult result;
    private String    error;
    private Instant   startedAt;
    private Instant   finishedAt;
    private Instant   updatedAt;

    public Job(String jobId, JobOperation operation, Map<String, Object> params, Instant createdAt) {
        this.jobId     = jobId;
        this.operation = operation;
        this.params    = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.progress  = "Queued";
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    public synchronized void markRunning(Instant now) {
        this.status    = JobStatus.RUNNING;
        this.startedAt = now;
        this.updatedAt = now;
    }

    public synchronized void updateProgress(String progress, Instant now) {
        this.progress  = progress;
        this.updatedAt = now;
    }

    public synchronized void complete(JobResult result, Instant now) {
        this.status     = JobStatus.COMPLETED;
        this.result     = result;
        this.message    = result.message();
        this.progress   = "Done";
        this.finishedAt = now;
        this.updatedAt  = now;
    }

    public synchronized void fail(String error, JobResult partial, Instant now) {
        this.status     = JobStatus.FAILED;
        this.error      = error;
        this.result     = partial;
        this.message    = "Job failed: " + error;
        this.finishedAt = now;
        this.updatedAt  = now;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String              getJobId()      { return jobId; }
    public JobOperation        getOperation()  { return operation; }
    public Map<String, Object> getParams()     { return params; }
    public Instant             getCreatedAt()  { return createdAt; }

    public synchronized JobStatus getStatus()     { return status; }
    public synchronized String    getProgress()   { return progress; }
    public synchronized String    getMessage()    { return message; }
    public synchronized JobResult getResult()     { return result; }
    public synchronized String    getError()      { return error; }
    public synchronized Instant   getStartedAt()  { return startedAt; }
    public synchronized Instant   getFinishedAt() { return finishedAt; }
    public synchronized Instant   getUpdatedAt()  { return updatedAt; }
}
