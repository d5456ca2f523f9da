package com.skillforge.engine.assembly;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

public class SkillNotFoundException extends SkillEngineException {

    public SkillNotFoundException(String operation, String skillId) {
        super(ErrorCode.SKILL_NOT_FOUND, operation, "skill_id=" + skillId, "no skill with this id in the metadata store");
    }
}
