package com.gt.recall.reviewSession;

import com.gt.recall.model.*;
import com.gt.recall.scheduler.SrsScheduler;
import com.gt.recall.trainer.TrainerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class ReviewSessionRegistry implements SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionRegistry.class);

    private final ConcurrentMap<String, ReviewSession> sessions = new ConcurrentHashMap<>();

    private final TrainerFactory trainerFactory;
    private final SrsScheduler scheduler;
    private final Clock clock;
    private final int maxQueueSize;
    private final Duration renderTimeout;

    public ReviewSessionRegistry(TrainerFactory trainerFactory,
                                 SrsScheduler scheduler,
                                 Clock clock,
                                 int maxQueueSize,
                                 Duration renderTimeout) {
        this.trainerFactory = trainerFactory;
        this.scheduler = scheduler;
        this.clock = clock;

        this.maxQueueSize = maxQueueSize;
        this.renderTimeout = renderTimeout;
    }

    @Override
    public BeginResult begin(String userId, String collectionId, List<Item> items, TrainerMode mode, Instant now) {
        BeginResult[] result = new BeginResult[1];

        // compute() holds the per-key lock, so two begins for one user cannot both start a session
        sessions.compute(userId, (key, existing) -> {
            if (existing != null) {
                log.info("User {} already has an active review session on collection {}", userId, existing.collectionId());
                result[0] = new BeginResult(BeginStatus.AlreadyActive, userId, existing.collectionId(), existing.mode(),
                        existing.remainingItems().size());
                return existing;
            }

            if (!trainerFactory.isAvailable(mode)) {
                log.warn("Cannot start a {} review session for user {}, the mode requires sentence generation which is not available", mode, userId);
                result[0] = new BeginResult(BeginStatus.ModeUnavailable, userId, collectionId, mode, 0);
                return null;
            }

            ReviewSession session = new ReviewSession(userId, collectionId, mode, maxQueueSize, renderTimeout,
                    trainerFactory, scheduler, clock);
            session.loadQueue(items, now);

            int itemsDue = session.remainingItems().size();
            if (itemsDue == 0) {
                log.info("No items due for user {} on collection {}", userId, collectionId);
                result[0] = new BeginResult(BeginStatus.NothingDue, userId, collectionId, mode, 0);
                return null;
            }

            result[0] = new BeginResult(BeginStatus.Started, userId, collectionId, mode, itemsDue);
            return session;
        });

        return result[0];
    }

    @Override
    public Optional<ReviewSession> get(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    @Override
    public Optional<SessionSummary> end(String userId) {
        ReviewSession session = sessions.remove(userId);

        if (session == null) {
            log.warn("No active session to end for user {}", userId);
            return Optional.empty();
        }

        return Optional.of(session.end());
    }

    @Override
    public Optional<SessionSummary> end(String userId, ReviewSession expected) {
        if (!sessions.remove(userId, expected)) {
            return Optional.empty();
        }

        return Optional.of(expected.end());
    }

    @Override
    public Collection<String> activeUsers() {
        return Set.copyOf(sessions.keySet());
    }
}
