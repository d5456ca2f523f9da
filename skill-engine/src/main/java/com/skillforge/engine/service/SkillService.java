package com.skillforge.engine.service;

import com.skillforge.engine.assembly.SkillAssembler;
import com.skillforge.engine.collect.CollectionPrompt;
import com.skillforge.engine.collect.ParameterCollector;
import com.skillforge.engine.collect.ParameterValidator;
import com.skillforge.engine.execution.ExecutionAdapter;
import com.skillforge.engine.model.SkillBundle;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import com.skillforge.engine.model.SkillSummary;
import com.skillforge.engine.search.SearchRequest;
import com.skillforge.engine.search.SearchRouter;
import com.skillforge.engine.spec.SkillSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * The interactive request path:
 * Search Router → Skill Assembler → (optionally) Parameter Collector → Execution Adapter.
 *
 * Read-only with respect to the Record Stores.
 */
@Service
public class SkillService {

    private static final Logger log = LoggerFactory.getLogger(SkillService.class);

    private final SearchRouter       searchRouter;
    private final SkillAssembler     assembler;
    private final ParameterCollector collector;
    private final ParameterValidator validator;
    private final ExecutionAdapter   executionAdapter;

    public SkillService(SearchRouter searchRouter,
                        SkillAssembler assembler,
                        ParameterCollector collector,
                        ParameterValidator validator,
                        ExecutionAdapter executionAdapter) {
        this.searchRouter     = searchRouter;
        this.assembler        = assembler;
        this.collector        = collector;
        this.validator        = validator;
        this.executionAdapter = executionAdapter;
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    public List<SkillSummary> search(SearchRequest request) {
        return searchRouter.search(request);
    }

    public List<SkillSummary> listByDomain(String domain) {
        return searchRouter.listByDomain(domain);
    }

    public SkillMetadata getMetadata(String skillId) {
        return assembler.metadataOnly(skillId);
    }

    public List<SkillFile> getFiles(String skillId) {
        return assembler.files(skillId);
    }

    public SkillBundle getBundle(String skillId) {
        return assembler.assemble(skillId);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Direct execution with caller-supplied parameters. Supplied fields that
     * a parameter group declares are validated and coerced; missing ones are
     * left to the adapter, which reports them as missing inputs.
     */
    public Object executeSkill(String skillId, Map<String, Object> parameters) {
        SkillBundle bundle = assembler.assemble(skillId);
        SkillSpecification spec = bundle.requireSpecification("execute");
        Map<String, Object> validated = validator.validateProvided(
                spec.parameterGroups(), parameters == null ? Map.of() : parameters,
                "execute", "skill_id=" + skillId);
        log.info("Executing skill '{}' with {} parameter(s)", skillId, validated.size());
        return executionAdapter.execute(bundle, validated);
    }

    // ------------------------------------------------------------------
    // Interactive collection
    // ------------------------------------------------------------------

    public CollectionPrompt startCollection(String skillId, String callerId) {
        return collector.start(callerId, assembler.assemble(skillId));
    }

    public CollectionPrompt currentPrompt(String sessionId) {
        return collector.currentPrompt(sessionId);
    }

    public CollectionPrompt submitAnswers(String sessionId, Integer groupIndex, Map<String, Object> answers) {
        return collector.submitGroupAnswers(sessionId, groupIndex, answers);
    }

    public void cancelCollection(String sessionId) {
        collector.cancel(sessionId);
    }

    /** Executes the skill with a completed session's parameters; the session is consumed. */
    public Object executeCollected(String sessionId) {
        ParameterCollector.CompletedCollection completed = collector.consume(sessionId);
        log.info("Executing skill '{}' from session {}", completed.skillId(), sessionId);
        return executionAdapter.execute(assembler.assemble(completed.skillId()), completed.parameters());
    }
}
