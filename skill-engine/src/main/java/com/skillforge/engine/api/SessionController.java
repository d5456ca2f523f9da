package com.skillforge.engine.api;

import com.skillforge.engine.api.dto.CollectionPromptResponse;
import com.skillforge.engine.api.dto.ExecuteResponse;
import com.skillforge.engine.api.dto.SubmitAnswersRequest;
import com.skillforge.engine.collect.CollectionPrompt;
import com.skillforge.engine.service.SkillService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Interactive parameter collection.
 *
 * GET    /api/v1/sessions/{id}          — current prompt (idempotent)
 * POST   /api/v1/sessions/{id}/answers  — answer (or correct) one group
 * POST   /api/v1/sessions/{id}/execute  — run the skill with the collected parameters
 * DELETE /api/v1/sessions/{id}          — abandon
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final SkillService skillService;

    public SessionController(SkillService skillService) {
        this.skillService = skillService;
    }

    @GetMapping("/{sessionId}")
    public CollectionPromptResponse currentPrompt(@PathVariable String sessionId) {
        return CollectionPromptResponse.from(skillService.currentPrompt(sessionId));
    }

    @PostMapping("/{sessionId}/answers")
    public CollectionPromptResponse submitAnswers(@PathVariable String sessionId,
                                                  @RequestBody SubmitAnswersRequest req) {
        Map<String, Object> answers = req.answers() == null ? Map.of() : req.answers();
        CollectionPrompt prompt = skillService.submitAnswers(sessionId, req.groupIndex(), answers);
        return CollectionPromptResponse.from(prompt);
    }

    @PostMapping("/{sessionId}/execute")
    public ExecuteResponse execute(@PathVariable String sessionId) {
        CollectionPrompt prompt = skillService.currentPrompt(sessionId);
        return new ExecuteResponse(prompt.skillId(), skillService.executeCollected(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
        skillService.cancelCollection(sessionId);
        return ResponseEntity.noContent().build();
    }
}
