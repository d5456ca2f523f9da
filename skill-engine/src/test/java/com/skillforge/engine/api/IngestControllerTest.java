package com.skillforge.engine.api;

import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.ingest.IngestedSkill;
import com.skillforge.engine.ingest.IngestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IngestController.class)
class IngestControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean IngestionService ingestion;

    @Test
    void ingestFolder_returnsIndexedFiles() throws Exception {
        when(ingestion.ingestFolder("verify-expense-policy")).thenReturn(new IngestedSkill(
                "verify-expense-policy", 1, 3, List.of("ExpensePolicyCheck.java", "SKILL.md", "category_limits.csv")));

        mockMvc.perform(post("/api/v1/ingest/folder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folderName\":\"verify-expense-policy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skill_id").value("verify-expense-policy"))
                .andExpect(jsonPath("$.files_indexed").value(3))
                .andExpect(jsonPath("$.files.length()").value(3));
    }

    @Test
    void ingestFolder_escapingPath_returns400() throws Exception {
        when(ingestion.ingestFolder("../etc")).thenThrow(
                new ValidationException("ingestFolder", "folder=../etc", "folder must stay under /skills"));

        mockMvc.perform(post("/api/v1/ingest/folder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folderName\":\"../etc\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ingestFolder_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/ingest/folder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}
