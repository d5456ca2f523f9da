package com.skillforge.engine.collect;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

/** The session timed out or was cancelled. It cannot be resumed; start a new one. */
public class SessionAbandonedException extends SkillEngineException {

    public SessionAbandonedException(String operation, String sessionId) {
        super(ErrorCode.SESSION_ABANDONED, operation, "session_id=" + sessionId,
                "session was abandoned; start a new collection session");
    }
}
