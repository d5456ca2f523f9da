package com.skillforge.engine.collect;

import com.skillforge.engine.model.CollectionSession;
import com.skillforge.engine.model.SessionStatus;
import com.skillforge.engine.spec.ParameterField;
import com.skillforge.engine.spec.ParameterGroup;

import java.util.List;
import java.util.Map;

/**
 * What the caller should render next: the current group's fields while
 * collecting, or the complete parameter set once every group is answered.
 */
public record CollectionPrompt(
        String               sessionId,
        String               skillId,
        SessionStatus        status,
        int                  groupIndex,
        int                  groupCount,
        String               groupName,
        String               prompt,
        List<ParameterField> fields,
        Map<String, Object>  collected
) {

    static CollectionPrompt of(CollectionSession session) {
        Map<String, Object> collected = session.collectedFields();
        if (session.getStatus() != SessionStatus.COLLECTING) {
            return new CollectionPrompt(session.getSessionId(), session.getSkillId(), session.getStatus(),
                    session.getCurrentGroupIndex(), session.getGroupCount(), null, null, List.of(), collected);
        }
        ParameterGroup group = session.getGroups().get(session.getCurrentGroupIndex());
        return new CollectionPrompt(session.getSessionId(), session.getSkillId(), session.getStatus(),
                session.getCurrentGroupIndex(), session.getGroupCount(),
                group.name(), group.prompt(), group.fields(), collected);
    }

    public boolean isComplete() {
        return status == SessionStatus.COMPLETE;
    }
}
