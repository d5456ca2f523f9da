package com.skillforge.engine.spec;

import com.skillforge.engine.error.ErrorCode;
import com.skillforge.engine.error.SkillEngineException;

/** A step that needs the skill's SKILL.md ran against a bundle without one. */
public class SpecificationMissingException extends SkillEngineException {

    public SpecificationMissingException(String operation, String skillId) {
        super(ErrorCode.SPECIFICATION_MISSING, operation, "skill_id=" + skillId,
                "skill has no SKILL.md specification file");
    }
}
