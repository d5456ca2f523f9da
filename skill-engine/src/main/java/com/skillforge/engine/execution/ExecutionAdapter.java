package com.skillforge.engine.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillforge.engine.error.SkillEngineException;
import com.skillforge.engine.model.SkillBundle;
import com.skillforge.engine.spec.EntryPoint;
import com.skillforge.engine.spec.SkillSpecification;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a skill bundle with a parameter set.
 *
 * Each call builds a fresh isolated context (own directory, own class
 * loader, own thread), invokes the declared entry point under a per-call
 * timeout, normalizes the raw return value to plain maps/lists/scalars and
 * applies the declared output adapter. The context is destroyed before the
 * call returns. Nothing here writes to the Record Stores.
 *
 * Invocations never share worker threads: a skill that ignores interruption
 * after a timeout keeps only its own daemon thread busy and cannot delay
 * later calls.
 *
 * Every call is timed and counted:
 * <pre>
 *   skillforge.skill.calls{skill, status="success|entry_point_not_found|missing_required_input|runtime_fault|output_adapter_mismatch|timeout|error"}
 *   skillforge.skill.duration{skill}
 * </pre>
 */
@Component
public class ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionAdapter.class);

    private final SkillSourceCompiler compiler;
    private final ObjectMapper        json;
    private final MeterRegistry       meterRegistry;
    private final Duration            timeout;
    private final AtomicInteger       threadSeq = new AtomicInteger();

    public ExecutionAdapter(ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            @Value("${skillforge.execution.timeout:10s}") Duration timeout,
                            @Value("${skillforge.execution.work-dir:${java.io.tmpdir}/skillforge}") Path workRoot) {
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.timeout       = timeout;
        this.compiler      = new SkillSourceCompiler(workRoot, new InputMapper(objectMapper));
    }

    /**
     * @return the adapted result (or the normalized raw result when no adapter is declared)
     * @throws com.skillforge.engine.spec.SpecificationMissingException if the bundle has no SKILL.md
     * @throws SkillExecutionException on any of the execution failure kinds
     */
    public Object execute(SkillBundle bundle, Map<String, Object> parameters) {
        String skillId = bundle.skillId();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        MDC.put("skillId", skillId);
        try {
            SkillSpecification spec = bundle.requireSpecification("execute");
            EntryPoint entryPoint = spec.entryPointIfDeclared().orElseThrow(() -> new SkillExecutionException(
                    SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                    "SKILL.md declares no entry_point"));

            Object normalized;
            try (CompiledJavaSkill skill = compiler.load(bundle, spec, entryPoint)) {
                Object raw = invokeWithTimeout(skill, skillId, parameters == null ? Map.of() : parameters);
                // Convert while the skill's loader is still open; the result may reference its classes.
                normalized = json.convertValue(raw, Object.class);
            }
            Object result = OutputAdapterTransform.apply(spec.outputAdapter(), normalized, skillId);
            log.info("Skill '{}' executed via {}", skillId, entryPoint);
            return result;
        } catch (SkillExecutionException e) {
            status = e.getReason().equals("timeout") ? "timeout" : e.getKind().name().toLowerCase(Locale.ROOT);
            log.warn("Skill '{}' failed: {}", skillId, e.getMessage());
            throw e;
        } catch (SkillEngineException e) {
            status = "error";
            throw e;
        } catch (IllegalArgumentException e) {
            status = "runtime_fault";
            throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId,
                    "result is not convertible to structured data: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("skillforge.skill.duration", "skill", skillId));
            meterRegistry.counter("skillforge.skill.calls", "skill", skillId, "status", status).increment();
            MDC.remove("skillId");
        }
    }

    private Object invokeWithTimeout(SkillCallable skill, String skillId, Map<String, Object> parameters) {
        ExecutorService invocation = Executors.newSingleThreadExecutor(daemonThread(skillId));
        Future<Object> future = invocation.submit(() -> {
            MDC.put("skillId", skillId);
            try {
                return skill.invoke(parameters);
            } finally {
                MDC.remove("skillId");
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Skill '{}' exceeded {} ms; its thread was interrupted and abandoned", skillId, timeout.toMillis());
            throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId, "timeout", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId, "cancelled", e);
        } catch (ExecutionException e) {
            throw unwrap(skillId, skill, e.getCause());
        } finally {
            invocation.shutdownNow();
        }
    }

    private static SkillEngineException unwrap(String skillId, SkillCallable skill, Throwable failure) {
        if (failure instanceof SkillEngineException engine) {
            return engine;
        }
        Throwable original = failure instanceof InvocationTargetException ite && ite.getCause() != null
                ? ite.getCause()
                : failure;
        return new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId,
                skill.entryPointName() + " raised " + original.getClass().getSimpleName()
                        + ": " + original.getMessage(), original);
    }

    private ThreadFactory daemonThread(String skillId) {
        int n = threadSeq.incrementAndGet();
        return r -> {
            Thread t = new Thread(r, "skill-invoke-" + n + "-" + skillId);
            t.setDaemon(true);
            return t;
        };
    }
}
