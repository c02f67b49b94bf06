package com.gt.recall.review;

import com.gt.recall.exception.NoActiveSessionException;
import com.gt.recall.model.*;
import com.gt.recall.reviewSession.ReviewSession;
import com.gt.recall.reviewSession.SessionRegistry;
import com.gt.recall.scheduler.SrsScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final SessionRegistry sessionRegistry;
    private final SrsScheduler scheduler;
    private final Clock clock;

    @Autowired
    public ReviewSessionService(SessionRegistry sessionRegistry, SrsScheduler scheduler, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public BeginResult beginSession(String userId, String collectionId, List<Item> items, TrainerMode mode) {
        BeginResult result = sessionRegistry.begin(userId, collectionId, items, mode, clock.instant());

        log.info("Begin review for user {} on collection {} in {} mode: {} ({} items due)",
                userId, collectionId, mode, result.status(), result.itemsDue());

        return result;
    }

    public AdvanceResult nextItem(String userId) {
        AdvanceResult result = getSession(userId).advance().join();

        if (result.status() == AdvanceStatus.Exhausted) {
            log.info("Review session complete for user {}", userId);
        }

        return result;
    }

    // The caller persists the returned item
    public ReviewResult submitAnswer(String userId, String answer) {
        ReviewResult result = getSession(userId).grade(answer);

        log.info("Processed answer for user {} on item {}, correct: {}", userId, result.updatedItem().id(), result.grade().isCorrect());

        return result;
    }

    public void changeMode(String userId, TrainerMode mode) {
        getSession(userId).changeMode(mode);
    }

    public SessionProgress getProgress(String userId) {
        return getSession(userId).progress();
    }

    public SessionSummary endSession(String userId) {
        return sessionRegistry.end(userId)
                .orElseThrow(() -> new NoActiveSessionException("User " + userId + " does not have an active review session"));
    }

    public List<RatingDueTime> previewDueTimes(Item item) {
        return scheduler.previewDueTimes(item, clock.instant()).entrySet().stream()
                .map(entry -> new RatingDueTime(entry.getKey(), entry.getValue()))
                .toList();
    }

    private ReviewSession getSession(String userId) {
        return sessionRegistry.get(userId)
                .orElseThrow(() -> {
                    log.warn("No active session for user {}", userId);
                    return new NoActiveSessionException("User " + userId + " does not have an active review session");
                });
    }
}
