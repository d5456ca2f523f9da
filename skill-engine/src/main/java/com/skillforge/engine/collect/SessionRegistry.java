package com.skillforge.engine.collect;

import com.skillforge.engine.model.CollectionSession;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live collection sessions, by session id and by (caller, skill) key.
 * At most one live session exists per key.
 */
@Component
public class SessionRegistry {

    private final Map<String, CollectionSession> byId  = new ConcurrentHashMap<>();
    private final Map<String, String>            byKey = new ConcurrentHashMap<>();

    /**
     * Registers {@code session}, displacing any session for the same
     * (caller, skill) key. The displaced session stays resolvable by id, so
     * its holder learns it was abandoned, until the sweeper purges it.
     *
     * @return the displaced session, if any
     */
    public Optional<CollectionSession> register(CollectionSession session) {
        String previousId = byKey.put(key(session), session.getSessionId());
        byId.put(session.getSessionId(), session);
        if (previousId == null || previousId.equals(session.getSessionId())) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(previousId));
    }

    public Optional<CollectionSession> find(String sessionId) {
        return Optional.ofNullable(byId.get(sessionId));
    }

    public void remove(CollectionSession session) {
        byId.remove(session.getSessionId());
        byKey.remove(key(session), session.getSessionId());
    }

    public Collection<CollectionSession> all() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }

    private static String key(CollectionSession session) {
        return session.getCallerId() + "\u0000" + session.getSkillId();
    }
}
