package com.skillforge.engine.api;

import com.skillforge.engine.job.JobNotFoundException;
import com.skillforge.engine.job.JobPoller;
import com.skillforge.engine.job.WorkflowOrchestrator;
import com.skillforge.engine.model.IngestionFailure;
import com.skillforge.engine.model.Job;
import com.skillforge.engine.model.JobOperation;
import com.skillforge.engine.model.JobResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for JobController.
 *
 * WorkflowOrchestrator and JobPoller are mocked so the tests control job state precisely.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc               mockMvc;
    @MockitoBean WorkflowOrchestrator orchestrator;
    @MockitoBean JobPoller            poller;

    // ------------------------------------------------------------------
    // POST /api/v1/jobs
    // ------------------------------------------------------------------

    @Test
    void submit_validOperation_returns202WithJobId() throws Exception {
        Job job = new Job("ab12cd34", JobOperation.SETUP, Map.of("recreate", true), Instant.now());
        when(orchestrator.submit(eq(JobOperation.SETUP), anyMap())).thenReturn(job);

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operation":"setup","params":{"recreate":true}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value("ab12cd34"))
                .andExpect(jsonPath("$.operation").value("setup"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.progress").value("Queued"));
    }

    @Test
    void submit_unknownOperation_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\":\"reindex\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verify(orchestrator, never()).submit(any(), any());
    }

    @Test
    void submitOperation_shorthandRoute() throws Exception {
        Job job = new Job("ff00ff00", JobOperation.UPDATE_SKILLS, Map.of(), Instant.now());
        when(orchestrator.submit(eq(JobOperation.UPDATE_SKILLS), any())).thenReturn(job);

        mockMvc.perform(post("/api/v1/ops/{operation}", "update-skills"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.operation").value("update-skills"));
    }

    // ------------------------------------------------------------------
    // GET /api/v1/jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void poll_completedTeardown_reportsDeletedCount() throws Exception {
        Job job = new Job("ab12cd34", JobOperation.TEARDOWN, Map.of(), Instant.now());
        job.markRunning(Instant.now());
        job.complete(new JobResult(List.of(), List.of("agent_skills", "agent_skill_files"), List.of(),
                List.of("a", "b"), 0, List.of(), "Teardown complete: deleted 2 skills"), Instant.now());
        when(orchestrator.poll("ab12cd34")).thenReturn(job);

        mockMvc.perform(get("/api/v1/jobs/{id}", "ab12cd34"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.result.skills_deleted").value(2))
                .andExpect(jsonPath("$.result.deleted_skill_ids[1]").value("b"))
                .andExpect(jsonPath("$.finished_at").isNotEmpty());
    }

    @Test
    void poll_failedSetup_carriesPartialFailures() throws Exception {
        Job job = new Job("ab12cd34", JobOperation.SETUP, Map.of(), Instant.now());
        job.complete(new JobResult(List.of(), List.of(), List.of("good"), List.of(), 1,
                List.of(new IngestionFailure("bad", "SKILL.md not found")), "Setup complete: 1 skills indexed (1 files), 1 failed"),
                Instant.now());
        when(orchestrator.poll("ab12cd34")).thenReturn(job);

        mockMvc.perform(get("/api/v1/jobs/{id}", "ab12cd34"))
                .andExpect(jsonPath("$.result.failures[0].skill_id").value("bad"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void poll_unknownJob_returns404() throws Exception {
        when(orchestrator.poll("nope")).thenThrow(new JobNotFoundException("pollJob", "nope"));

        mockMvc.perform(get("/api/v1/jobs/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("JOB_NOT_FOUND"));
    }

    // ------------------------------------------------------------------
    // GET /api/v1/jobs/{id}/await
    // ------------------------------------------------------------------

    @Test
    void await_stillRunning_returns202() throws Exception {
        Job job = new Job("ab12cd34", JobOperation.SETUP, Map.of(), Instant.now());
        job.markRunning(Instant.now());
        when(poller.await("ab12cd34", Duration.ofMillis(50), 2)).thenReturn(new JobPoller.Outcome(job, true, 2));

        mockMvc.perform(get("/api/v1/jobs/{id}/await", "ab12cd34")
                        .param("intervalMs", "50")
                        .param("maxAttempts", "2"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void await_negativeInterval_returns400WithoutPolling() throws Exception {
        mockMvc.perform(get("/api/v1/jobs/{id}/await", "ab12cd34")
                        .param("intervalMs", "-5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.operation").value("awaitJob"));

        verify(poller, never()).await(any(), any(), anyInt());
    }

    @Test
    void await_totalWaitAboveCap_returns400WithoutPolling() throws Exception {
        mockMvc.perform(get("/api/v1/jobs/{id}/await", "ab12cd34")
                        .param("intervalMs", "60000")
                        .param("maxAttempts", "600"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/v1/jobs/{id}/await", "ab12cd34")
                        .param("maxAttempts", "2147483647"))
                .andExpect(status().isBadRequest());

        verify(poller, never()).await(any(), any(), anyInt());
    }

    // ------------------------------------------------------------------
    // DELETE /api/v1/jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void purge_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/jobs/{id}", "ab12cd34"))
                .andExpect(status().isNoContent());

        verify(orchestrator).purge("ab12cd34");
    }
}
