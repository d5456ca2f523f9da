package com.skillforge.engine.job;

import com.skillforge.engine.model.Job;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Submitted jobs, retained until purged or the process restarts. */
@Component
public class JobRegistry {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public void put(Job job) {
        jobs.put(job.getJobId(), job);
    }

    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /** Newest first. */
    public List<Job> all() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::getCreatedAt).reversed().thenComparing(Job::getJobId))
                .toList();
    }

    public boolean remove(String jobId) {
        return jobs.remove(jobId) != null;
    }
}
