package com.gt.recall.review;

import com.gt.recall.model.*;
import com.gt.recall.reviewSession.ReviewSession;
import com.gt.recall.reviewSession.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Wraps a {@link SessionRegistry} and ends sessions that have not been touched for longer than the idle timeout.
 * Eviction only runs when {@link #evictIdleSessions(Instant)} is called.
 */
public class IdleExpiringSessionRegistry implements SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdleExpiringSessionRegistry.class);

    private final SessionRegistry delegate;
    private final Clock clock;
    private final Duration idleTimeout;

    private final ConcurrentMap<String, Instant> lastAccess = new ConcurrentHashMap<>();

    public IdleExpiringSessionRegistry(SessionRegistry delegate, Clock clock, Duration idleTimeout) {
        this.delegate = delegate;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    @Override
    public BeginResult begin(String userId, String collectionId, List<Item> items, TrainerMode mode, Instant now) {
        BeginResult result = delegate.begin(userId, collectionId, items, mode, now);

        if (result.status() == BeginStatus.Started || result.status() == BeginStatus.AlreadyActive) {
            touch(userId);
        }

        return result;
    }

    @Override
    public Optional<ReviewSession> get(String userId) {
        Optional<ReviewSession> session = delegate.get(userId);

        if (session.isPresent()) {
            touch(userId);
        } else {
            lastAccess.remove(userId);
        }

        return session;
    }

    @Override
    public Optional<SessionSummary> end(String userId) {
        lastAccess.remove(userId);

        return delegate.end(userId);
    }

    @Override
    public Optional<SessionSummary> end(String userId, ReviewSession expected) {
        Optional<SessionSummary> summary = delegate.end(userId, expected);
        summary.ifPresent(ended -> lastAccess.remove(userId));

        return summary;
    }

    @Override
    public Collection<String> activeUsers() {
        return delegate.activeUsers();
    }

    public List<SessionSummary> evictIdleSessions(Instant now) {
        List<SessionSummary> evicted = new ArrayList<>();

        for (String userId : delegate.activeUsers()) {
            Optional<ReviewSession> session = delegate.get(userId);
            Instant lastAccessed = lastAccess.putIfAbsent(userId, now);

            // only the session seen before the idle check is ended, a replacement started meanwhile is kept
            if (session.isPresent()
                    && lastAccessed != null
                    && Duration.between(lastAccessed, now).compareTo(idleTimeout) > 0
                    && lastAccess.remove(userId, lastAccessed)) {
                delegate.end(userId, session.get()).ifPresent(summary -> {
                    log.info("Ended review session for user {} after {} minutes idle", userId, Duration.between(lastAccessed, now).toMinutes());
                    evicted.add(summary);
                });
            }
        }

        return evicted;
    }

    private void touch(String userId) {
        lastAccess.put(userId, clock.instant());
    }
}
