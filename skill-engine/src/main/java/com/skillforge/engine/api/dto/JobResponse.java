package com.skillforge.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.skillforge.engine.model.Job;
import com.skillforge.engine.model.JobResult;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Response body for job submission and polling.
 * Contains enough information for the caller to poll job progress.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String  jobId,
        String  operation,
        String  status,
        String  progress,
        String  message,
        Result  result,
        String  error,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Result(
            List<String>  storesCreated,
            List<String>  storesDeleted,
            List<String>  skillsCreated,
            int           skillsDeleted,
            List<String>  deletedSkillIds,
            int           filesIndexed,
            List<Failure> failures
    ) {
        static Result from(JobResult r) {
            return new Result(r.storesCreated(), r.storesDeleted(), r.skillsCreated(),
                    r.skillsDeleted().size(), r.skillsDeleted(), r.filesIndexed(),
                    r.failures().stream().map(f -> new Failure(f.skillId(), f.reason())).toList());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Failure(String skillId, String reason) {}

    public static JobResponse from(Job job) {
        JobResult result = job.getResult();
        return new JobResponse(
                job.getJobId(),
                job.getOperation().wireName(),
                job.getStatus().name().toLowerCase(Locale.ROOT),
                job.getProgress(),
                job.getMessage(),
                result == null ? null : Result.from(result),
                job.getError(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getFinishedAt());
    }
}
