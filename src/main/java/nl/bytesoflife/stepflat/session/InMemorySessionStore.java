package nl.bytesoflife.stepflat.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store backed by a concurrent map. Sessions expire a fixed time after creation;
 * expired entries are dropped whenever the store is touched.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, FaceSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStore(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemorySessionStore(Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Session TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public void insert(FaceSession session) {
        evictExpired();
        sessions.put(session.id(), session);
        log.debug("Stored session {} ({} faces)", session.id(), session.faceCount());
    }

    @Override
    public Optional<FaceSession> get(String sessionId) {
        if (sessionId == null) return Optional.empty();
        FaceSession session = sessions.get(sessionId);
        if (session != null && isExpired(session, clock.instant())) {
            sessions.remove(sessionId, session);
            log.debug("Session {} expired", sessionId);
            return Optional.empty();
        }
        return Optional.ofNullable(session);
    }

    @Override
    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @Override
    public int size() {
        evictExpired();
        return sessions.size();
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(session -> isExpired(session, now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} expired sessions", evicted);
        }
        return evicted;
    }

    private boolean isExpired(FaceSession session, Instant now) {
        return !session.createdAt().plus(ttl).isAfter(now);
    }
}
