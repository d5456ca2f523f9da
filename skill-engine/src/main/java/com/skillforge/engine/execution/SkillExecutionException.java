package com.skillforge.engine.execution;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

/**
 * Thrown when invoking a skill's entry point fails.
 *
 * {@link Kind#RUNTIME_FAULT} preserves the hot-loaded logic's own failure
 * message in the cause text and keeps the original throwable as the cause.
 */
public class SkillExecutionException extends SkillEngineException {

    public enum Kind {
        ENTRY_POINT_NOT_FOUND(ErrorCode.ENTRY_POINT_NOT_FOUND),
        MISSING_REQUIRED_INPUT(ErrorCode.MISSING_REQUIRED_INPUT),
        RUNTIME_FAULT(ErrorCode.RUNTIME_FAULT),
        OUTPUT_ADAPTER_MISMATCH(ErrorCode.OUTPUT_ADAPTER_MISMATCH);

        private final ErrorCode code;

        Kind(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode code() { return code; }
    }

    private final Kind kind;

    public SkillExecutionException(Kind kind, String skillId, String message) {
        this(kind, skillId, message, null);
    }

    public SkillExecutionException(Kind kind, String skillId, String message, Throwable cause) {
        super(kind.code(), "execute", "skill_id=" + skillId, message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
