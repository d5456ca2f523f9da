package com.skillforge.engine.api;

import com.skillforge.engine.api.dto.CollectionPromptResponse;
import com.skillforge.engine.api.dto.ExecuteRequest;
import com.skillforge.engine.api.dto.ExecuteResponse;
import com.skillforge.engine.api.dto.SkillFileResponse;
import com.skillforge.engine.api.dto.SkillMetadataResponse;
import com.skillforge.engine.api.dto.SkillSummaryResponse;
import com.skillforge.engine.api.dto.StartCollectionRequest;
import com.skillforge.engine.search.SearchRequest;
import com.skillforge.engine.service.SkillService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Discovery and execution surface.
 *
 * GET  /api/v1/skills/search?q=&domain=&tags=&matchAllTags=&limit=
 * GET  /api/v1/skills?domain=            — all skills of a domain, best rated first
 * GET  /api/v1/skills/{skillId}          — metadata only
 * GET  /api/v1/skills/{skillId}/files    — file records
 * GET  /api/v1/skills/{skillId}/bundle   — legacy single-document view
 * POST /api/v1/skills/{skillId}/execute  — run with a flat parameter object
 * POST /api/v1/skills/{skillId}/sessions — start interactive parameter collection
 */
@RestController
@RequestMapping("/api/v1/skills")
public class SkillController {

    private final SkillService skillService;

    public SkillController(SkillService skillService) {
        this.skillService = skillService;
    }

    /**
     * Example:
     *   curl 'http://localhost:8080/api/v1/skills/search?q=storm%20damage%20claim&domain=insurance&limit=1'
     */
    @GetMapping("/search")
    public List<SkillSummaryResponse> search(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(defaultValue = "false") boolean matchAllTags,
            @RequestParam(required = false) Integer limit) {
        SearchRequest request = new SearchRequest(query, domain, tags, matchAllTags, limit);
        return skillService.search(request).stream().map(SkillSummaryResponse::from).toList();
    }

    @GetMapping
    public List<SkillSummaryResponse> listByDomain(@RequestParam String domain) {
        return skillService.listByDomain(domain).stream().map(SkillSummaryResponse::from).toList();
    }

    @GetMapping("/{skillId}")
    public SkillMetadataResponse getMetadata(@PathVariable String skillId) {
        return SkillMetadataResponse.from(skillService.getMetadata(skillId));
    }

    @GetMapping("/{skillId}/files")
    public List<SkillFileResponse> getFiles(@PathVariable String skillId) {
        return skillService.getFiles(skillId).stream().map(SkillFileResponse::from).toList();
    }

    @GetMapping("/{skillId}/bundle")
    public Map<String, Object> getBundle(@PathVariable String skillId) {
        return skillService.getBundle(skillId).legacyDocument();
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/skills/verify-expense-policy/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"parameters":{"amount":850,"category":"Travel","approvals":[]}}'
     */
    @PostMapping("/{skillId}/execute")
    public ExecuteResponse execute(@PathVariable String skillId,
                                   @RequestBody(required = false) ExecuteRequest req) {
        Map<String, Object> parameters = req == null || req.parameters() == null ? Map.of() : req.parameters();
        return new ExecuteResponse(skillId, skillService.executeSkill(skillId, parameters));
    }

    @PostMapping("/{skillId}/sessions")
    public ResponseEntity<CollectionPromptResponse> startCollection(
            @PathVariable String skillId,
            @RequestBody(required = false) StartCollectionRequest req) {
        String callerId = req == null ? null : req.callerId();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CollectionPromptResponse.from(skillService.startCollection(skillId, callerId)));
    }
}
