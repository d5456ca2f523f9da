package com.skillforge.engine.search;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

/** The Metadata Store stayed unreachable through every retry. Never reported as an empty result. */
public class SearchUnavailableException extends SkillEngineException {

    public SearchUnavailableException(String operation, String key, String cause, Throwable throwable) {
        super(ErrorCode.SEARCH_UNAVAILABLE, operation, key, cause, throwable);
    }
}
