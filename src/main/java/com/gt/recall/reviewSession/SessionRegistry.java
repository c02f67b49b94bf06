package com.gt.recall.reviewSession;

import com.gt.recall.model.BeginResult;
import com.gt.recall.model.Item;
import com.gt.recall.model.SessionSummary;
import com.gt.recall.model.TrainerMode;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Holds at most one live {@link ReviewSession} per user.
 */
public interface SessionRegistry {

    /**
     * Starts a session over the due subset of {@code items}. An existing session for the user is left untouched and
     * reported as {@link com.gt.recall.model.BeginStatus#AlreadyActive}.
     */
    BeginResult begin(String userId, String collectionId, List<Item> items, TrainerMode mode, Instant now);

    Optional<ReviewSession> get(String userId);

    /**
     * Removes the user's session and returns its summary. Items still queued keep their scheduling metadata.
     */
    Optional<SessionSummary> end(String userId);

    /**
     * Ends the user's session only if it is still {@code expected}. Returns empty when the user has no session or
     * has since started another one.
     */
    Optional<SessionSummary> end(String userId, ReviewSession expected);

    Collection<String> activeUsers();
}
