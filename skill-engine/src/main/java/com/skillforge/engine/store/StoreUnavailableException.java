package com.skillforge.engine.store;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

/** The backing search engine could not be reached or refused the request. Retryable. */
public class StoreUnavailableException extends SkillEngineException {

    public StoreUnavailableException(String operation, String key, String cause) {
        super(ErrorCode.STORE_UNAVAILABLE, operation, key, cause);
    }

    public StoreUnavailableException(String operation, String key, String cause, Throwable throwable) {
        super(ErrorCode.STORE_UNAVAILABLE, operation, key, cause, throwable);
    }
}
