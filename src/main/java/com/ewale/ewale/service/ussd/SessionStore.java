package com.ewale.ewale.service.ussd;

import com.ewale.ewale.exception.SessionNotFoundException;

import java.util.Optional;

/**
 * Keyed storage for USSD session state. No locking: concurrent writers on the same id, last write wins.
 */
public interface SessionStore {

    SessionState create(String sessionId);

    Optional<SessionState> get(String sessionId);

    /**
     * @throws SessionNotFoundException when no session exists under {@code sessionId}
     */
    void update(String sessionId, SessionState state);

    void delete(String sessionId);

    boolean exists(String sessionId);

    long count();
}
