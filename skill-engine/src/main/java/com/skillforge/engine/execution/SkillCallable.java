package com.skillforge.engine.execution;

import java.util.Map;

/**
 * A hot-loaded skill reduced to the one capability the engine needs: call the
 * entry point with named inputs.
 */
public interface SkillCallable extends AutoCloseable {

    /** {@code ClassName.methodName} of the bound entry point. */
    String entryPointName();

    /**
     * Maps {@code inputs} onto the entry point's parameters and calls it.
     *
     * @return the raw return value of the entry point
     * @throws SkillExecutionException  on a missing input
     * @throws Exception                whatever the skill's own logic throws
     */
    Object invoke(Map<String, Object> inputs) throws Exception;

    /** Releases the isolated context. */
    @Override
    void close();
}
