package com.skillforge.engine.collect;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

public class SessionNotFoundException extends SkillEngineException {

    public SessionNotFoundException(String operation, String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, operation, "session_id=" + sessionId,
                "no live collection session with this id");
    }
}
