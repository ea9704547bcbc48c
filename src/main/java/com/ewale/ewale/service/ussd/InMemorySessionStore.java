package com.ewale.ewale.service.ussd;

import com.ewale.ewale.exception.SessionNotFoundException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded map store. Sessions live until they are released.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public SessionState create(String sessionId) {
        SessionState state = new SessionState(sessionId);
        sessions.put(sessionId, state);
        return state;
    }

    @Override
    public Optional<SessionState> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void update(String sessionId, SessionState state) {
        if (sessions.computeIfPresent(sessionId, (id, old) -> state) == null) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId != null) {
            sessions.remove(sessionId);
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    @Override
    public long count() {
        return sessions.size();
    }
}
