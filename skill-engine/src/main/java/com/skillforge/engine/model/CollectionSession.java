package com.skillforge.engine.model;

import com.skillforge.engine.spec.ParameterGroup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interactive parameter collection for one (caller, skill) pair.
 *
 * Answers are kept per group so a correction of group {@code i} can drop
 * exactly the answers of groups {@code > i}. Mutated only by the
 * ParameterCollector, which serializes access per session by locking on the
 * session instance.
 */
public class CollectionSession {

    private final String  sessionId;
    private final String  callerId;
    private final String  skillId;
    private final Instant createdAt;

    private final List<ParameterGroup>      groups;
    private final List<Map<String, Object>> answersByGroup = new ArrayList<>();

    private int           currentGroupIndex;
    private SessionStatus status = SessionStatus.COLLECTING;
    private Instant       lastActivityAt;
    private boolean       consumed;

    public CollectionSession(String sessionId, String callerId, String skillId,
                             List<ParameterGroup> groups, Instant now) {
        this.sessionId      = sessionId;
        this.callerId       = callerId;
        this.skillId        = skillId;
        this.groups         = List.copyOf(groups);
        this.createdAt      = now;
        this.lastActivityAt = now;
        for (int i = 0; i < this.groups.size(); i++) {
            answersByGroup.add(null);
        }
        if (this.groups.isEmpty()) {
            status = SessionStatus.COMPLETE;
        }
    }

    // ------------------------------------------------------------------
    // Mutation (collector only)
    // ------------------------------------------------------------------

    /** Stores validated answers for {@code groupIndex} and advances the cursor past it. */
    public void acceptGroup(int groupIndex, Map<String, Object> answers, Instant now) {
        answersByGroup.set(groupIndex, new LinkedHashMap<>(answers));
        for (int i = groupIndex + 1; i < groups.size(); i++) {
            answersByGroup.set(i, null);
        }
        currentGroupIndex = groupIndex + 1;
        status = currentGroupIndex >= groups.size() ? SessionStatus.COMPLETE : SessionStatus.COLLECTING;
        lastActivityAt = now;
    }

    public void touch(Instant now) {
        lastActivityAt = now;
    }

    public void abandon(Instant now) {
        status = SessionStatus.ABANDONED;
        lastActivityAt = now;
    }

    public void markConsumed() {
        consumed = true;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Every group's answers merged in group order. */
    public Map<String, Object> collectedFields() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, Object> answers : answersByGroup) {
            if (answers != null) merged.putAll(answers);
        }
        return merged;
    }

    public boolean hasAnswersFor(int groupIndex) {
        return answersByGroup.get(groupIndex) != null;
    }

    /** True only when every declared group holds validated answers. */
    public boolean allGroupsAnswered() {
        return answersByGroup.stream().allMatch(a -> a != null);
    }

    public String        getSessionId()         { return sessionId; }
    public String        getCallerId()          { return callerId; }
    public String        getSkillId()           { return skillId; }
    public List<ParameterGroup> getGroups()     { return groups; }
    public int           getGroupCount()        { return groups.size(); }
    public int           getCurrentGroupIndex() { return currentGroupIndex; }
    public SessionStatus getStatus()            { return status; }
    public Instant       getCreatedAt()         { return createdAt; }
    public Instant       getLastActivityAt()    { return lastActivityAt; }
    public boolean       isConsumed()           { return consumed; }
}
