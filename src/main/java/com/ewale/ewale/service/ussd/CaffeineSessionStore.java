package com.ewale.ewale.service.ussd;

import com.ewale.ewale.exception.SessionNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed store. With a positive idle timeout, sessions untouched for that long are evicted.
 */
public class CaffeineSessionStore implements SessionStore {

    private final Cache<String, SessionState> cache;

    public CaffeineSessionStore(long maximumSize, Duration idleTimeout) {
        this(maximumSize, idleTimeout, Ticker.systemTicker());
    }

    CaffeineSessionStore(long maximumSize, Duration idleTimeout, Ticker ticker) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker);
        if (idleTimeout != null && !idleTimeout.isZero() && !idleTimeout.isNegative()) {
            builder.expireAfterAccess(idleTimeout);
        }
        this.cache = builder.build();
    }

    @Override
    public SessionState create(String sessionId) {
        SessionState state = new SessionState(sessionId);
        cache.put(sessionId, state);
        return state;
    }

    @Override
    public Optional<SessionState> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(sessionId));
    }

    @Override
    public void update(String sessionId, SessionState state) {
        if (cache.asMap().computeIfPresent(sessionId, (id, old) -> state) == null) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId != null) {
            cache.invalidate(sessionId);
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return sessionId != null && cache.getIfPresent(sessionId) != null;
    }

    @Override
    public long count() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
