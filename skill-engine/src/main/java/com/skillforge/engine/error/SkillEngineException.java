package com.skillforge.engine.error;

/**
 * Base type for every failure the engine surfaces to callers.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. The message always names the operation attempted, the key
 * involved (skill_id, job_id or session_id) and a human-readable cause:
 * <pre>
 *   [SKILL_NOT_FOUND] assemble(skill_id=verify-expense-policy): no metadata record
 * </pre>
 */
public class SkillEngineException extends RuntimeException {

    private final ErrorCode code;
    private final String    operation;
    private final String    key;
    private final String    cause;

    public SkillEngineException(ErrorCode code, String operation, String key, String cause) {
        this(code, operation, key, cause, null);
    }

    public SkillEngineException(ErrorCode code, String operation, String key, String cause, Throwable throwable) {
        super(format(code, operation, key, cause), throwable);
        this.code      = code;
        this.operation = operation;
        this.key       = key;
        this.cause     = cause;
    }

    public ErrorCode getCode()      { return code; }
    public String    getOperation() { return operation; }
    public String    getKey()       { return key; }

    /** The human-readable cause without the code/operation prefix. */
    public String getReason()       { return cause; }

    private static String format(ErrorCode code, String operation, String key, String cause) {
        return "[" + code + "] " + operation + "(" + key + "): " + cause;
    }
}
