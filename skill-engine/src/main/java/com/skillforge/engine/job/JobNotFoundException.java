package com.skillforge.engine.job;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

public class JobNotFoundException extends SkillEngineException {

    public JobNotFoundException(String operation, String jobId) {
        super(ErrorCode.JOB_NOT_FOUND, operation, "job_id=" + jobId, "no job with this id (purged or never submitted)");
    }
}
