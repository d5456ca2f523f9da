package com.skillforge.engine.collect;

import com.skillforge.engine.error.ValidationException;
import com.skillforge.engine.model.CollectionSession;
import com.skillforge.engine.model.SessionStatus;
import com.skillforge.engine.model.SkillBundle;
import com.skillforge.engine.spec.ParameterGroup;
import com.skillforge.engine.spec.SkillSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Multi-turn parameter collection.
 *
 * <pre>
 *   start ──► COLLECTING(0) ──► COLLECTING(1) ──► ... ──► COMPLETE
 *                  └──────── idle timeout / cancel ──────► ABANDONED
 * </pre>
 *
 * Groups are answered strictly in order. Submitting an earlier group again is
 * a correction: its answers are replaced, every later group's answers are
 * dropped and collection resumes right after the corrected group. A session
 * reaches COMPLETE only when every group holds validated answers.
 *
 * Each session is mutated under its own monitor; sessions of different
 * callers or skills never contend.
 */
@Component
public class ParameterCollector {

    private static final Logger log = LoggerFactory.getLogger(ParameterCollector.class);

    private final SessionRegistry    sessions;
    private final ParameterValidator validator;
    private final Clock              clock;
    private final Duration           idleTimeout;

    public ParameterCollector(SessionRegistry sessions,
                              ParameterValidator validator,
                              Clock clock,
                              @Value("${skillforge.collection.session-timeout:30m}") Duration idleTimeout) {
        this.sessions    = sessions;
        this.validator   = validator;
        this.clock       = clock;
        this.idleTimeout = idleTimeout;
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    /**
     * Opens a session for {@code callerId} on the bundle's skill, replacing any
     * live session of the same caller on the same skill. A skill declaring no
     * parameter groups yields an already COMPLETE session with no fields.
     *
     * @throws com.skillforge.engine.spec.SpecificationMissingException if the skill has no SKILL.md
     */
    public CollectionPrompt start(String callerId, SkillBundle bundle) {
        SkillSpecification spec = bundle.requireSpecification("startCollection");
        String caller = callerId == null || callerId.isBlank() ? "anonymous" : callerId.strip();

        CollectionSession session = new CollectionSession(
                UUID.randomUUID().toString(), caller, bundle.skillId(), spec.parameterGroups(), clock.instant());
        sessions.register(session).ifPresent(previous -> {
            synchronized (previous) {
                previous.abandon(clock.instant());
            }
            log.info("Session {} replaced by {} for caller '{}' on skill '{}'",
                    previous.getSessionId(), session.getSessionId(), caller, bundle.skillId());
        });

        log.info("Started collection session {} for skill '{}' ({} groups)",
                session.getSessionId(), bundle.skillId(), session.getGroupCount());
        return CollectionPrompt.of(session);
    }

    /** Current prompt; no side effects beyond the idle-timeout check. */
    public CollectionPrompt currentPrompt(String sessionId) {
        CollectionSession session = live("currentPrompt", sessionId);
        synchronized (session) {
            checkActive("currentPrompt", session);
            return CollectionPrompt.of(session);
        }
    }

    /**
     * Validates and records one group's answers.
     *
     * @param groupIndex the group being answered; null means the current group
     * @throws ValidationException       on any invalid answer (nothing is recorded) or an out-of-order index
     * @throws SessionAbandonedException if the session timed out or was cancelled
     */
    public CollectionPrompt submitGroupAnswers(String sessionId, Integer groupIndex, Map<String, Object> answers) {
        CollectionSession session = live("submitAnswers", sessionId);
        synchronized (session) {
            checkActive("submitAnswers", session);
            String key = "session_id=" + sessionId;

            int index = groupIndex == null ? session.getCurrentGroupIndex() : groupIndex;
            if (session.getGroupCount() == 0) {
                throw new ValidationException("submitAnswers", key, "skill declares no parameter groups");
            }
            if (index < 0 || index >= session.getGroupCount()) {
                throw new ValidationException("submitAnswers", key,
                        "group index " + index + " is outside 0.." + (session.getGroupCount() - 1));
            }
            if (index > session.getCurrentGroupIndex()) {
                throw new ValidationException("submitAnswers", key,
                        "group " + index + " submitted before group " + session.getCurrentGroupIndex());
            }

            ParameterGroup group = session.getGroups().get(index);
            Map<String, Object> accepted = validator.validateGroup(group, answers, "submitAnswers", key);

            boolean correction = index < session.getCurrentGroupIndex();
            session.acceptGroup(index, accepted, clock.instant());
            if (correction) {
                log.info("Session {} corrected group {} ('{}'); later answers discarded",
                        sessionId, index, group.name());
            }
            if (session.getStatus() == SessionStatus.COMPLETE) {
                log.info("Session {} complete for skill '{}'", sessionId, session.getSkillId());
            }
            return CollectionPrompt.of(session);
        }
    }

    /** Abandons the session immediately. Further calls raise {@link SessionAbandonedException}. */
    public void cancel(String sessionId) {
        CollectionSession session = live("cancel", sessionId);
        synchronized (session) {
            checkActive("cancel", session);
            session.abandon(clock.instant());
        }
        log.info("Session {} cancelled by caller", sessionId);
    }

    /**
     * Hands out the collected parameter set of a COMPLETE session exactly once
     * and destroys the session.
     */
    public CompletedCollection consume(String sessionId) {
        CollectionSession session = live("executeSession", sessionId);
        synchronized (session) {
            checkActive("executeSession", session);
            String key = "session_id=" + sessionId;
            if (session.getStatus() != SessionStatus.COMPLETE || !session.allGroupsAnswered()) {
                throw new ValidationException("executeSession", key,
                        "session is still collecting group " + session.getCurrentGroupIndex());
            }
            if (session.isConsumed()) {
                throw new ValidationException("executeSession", key, "session was already executed");
            }
            session.markConsumed();
            sessions.remove(session);
            return new CompletedCollection(session.getSkillId(), session.collectedFields());
        }
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    /**
     * Marks idle sessions ABANDONED and purges sessions that have stayed
     * abandoned for a further timeout period.
     *
     * @return number of sessions purged
     */
    public int sweep() {
        Instant now = clock.instant();
        int purged = 0;
        for (CollectionSession session : sessions.all()) {
            synchronized (session) {
                if (session.getStatus() != SessionStatus.ABANDONED && isIdle(session, now)) {
                    session.abandon(session.getLastActivityAt().plus(idleTimeout));
                }
                if (session.getStatus() == SessionStatus.ABANDONED
                        && session.getLastActivityAt().plus(idleTimeout).isBefore(now)) {
                    sessions.remove(session);
                    purged++;
                }
            }
        }
        if (purged > 0) {
            log.info("Purged {} abandoned collection session(s)", purged);
        }
        return purged;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CollectionSession live(String operation, String sessionId) {
        return sessions.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(operation, sessionId));
    }

    /** Applies the idle timeout, then rejects abandoned sessions. Caller holds the session monitor. */
    private void checkActive(String operation, CollectionSession session) {
        if (session.getStatus() != SessionStatus.ABANDONED && isIdle(session, clock.instant())) {
            session.abandon(session.getLastActivityAt().plus(idleTimeout));
            log.info("Session {} abandoned after {} idle", session.getSessionId(), idleTimeout);
        }
        if (session.getStatus() == SessionStatus.ABANDONED) {
            throw new SessionAbandonedException(operation, session.getSessionId());
        }
    }

    private boolean isIdle(CollectionSession session, Instant now) {
        return session.getLastActivityAt().plus(idleTimeout).isBefore(now);
    }

    /** The output of a completed session, ready for execution. */
    public record CompletedCollection(String skillId, Map<String, Object> parameters) {}
}
