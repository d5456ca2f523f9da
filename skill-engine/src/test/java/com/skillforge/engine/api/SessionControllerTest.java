package com.skillforge.engine.api;

import com.skillforge.engine.collect.CollectionPrompt;
import com.skillforge.engine.collect.SessionAbandonedException;
import com.skillforge.engine.collect.SessionNotFoundException;
import com.skillforge.engine.model.SessionStatus;
import com.skillforge.engine.service.SkillService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired MockMvc       mockMvc;
    @MockitoBean SkillService skillService;

    @Test
    void submitAnswers_lastGroup_returnsCompleteWithCollected() throws Exception {
        when(skillService.submitAnswers(eq("s-1"), eq(1), anyMap())).thenReturn(complete());

        mockMvc.perform(post("/api/v1/sessions/{id}/answers", "s-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"groupIndex":1,"answers":{"interval_km":10000,"priority":"high"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.group_name").doesNotExist())
                .andExpect(jsonPath("$.collected.interval_km").value(10000));
    }

    @Test
    void currentPrompt_unknownSession_returns404() throws Exception {
        when(skillService.currentPrompt("nope")).thenThrow(new SessionNotFoundException("currentPrompt", "nope"));

        mockMvc.perform(get("/api/v1/sessions/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SESSION_NOT_FOUND"));
    }

    @Test
    void currentPrompt_abandonedSession_returns410() throws Exception {
        when(skillService.currentPrompt("old")).thenThrow(new SessionAbandonedException("currentPrompt", "old"));

        mockMvc.perform(get("/api/v1/sessions/{id}", "old"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.error").value("SESSION_ABANDONED"));
    }

    @Test
    void cancel_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/sessions/{id}", "s-1"))
                .andExpect(status().isNoContent());

        verify(skillService).cancelCollection("s-1");
    }

    @Test
    void cancel_alreadyAbandoned_returns410() throws Exception {
        doThrow(new SessionAbandonedException("cancel", "s-1")).when(skillService).cancelCollection("s-1");

        mockMvc.perform(delete("/api/v1/sessions/{id}", "s-1"))
                .andExpect(status().isGone());
    }

    @Test
    void execute_completeSession_returnsResult() throws Exception {
        when(skillService.currentPrompt("s-1")).thenReturn(complete());
        when(skillService.executeCollected("s-1")).thenReturn(Map.of("next_service_km", 50000));

        mockMvc.perform(post("/api/v1/sessions/{id}/execute", "s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skill_id").value("plan-fleet-maintenance"))
                .andExpect(jsonPath("$.result.next_service_km").value(50000));
    }

    private static CollectionPrompt complete() {
        return new CollectionPrompt("s-1", "plan-fleet-maintenance", SessionStatus.COMPLETE, 2, 2,
                null, null, List.of(), Map.of("interval_km", 10000L, "priority", "high"));
    }
}
