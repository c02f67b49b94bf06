package com.gt.recall.reviewSession;

import com.gt.recall.model.*;
import com.gt.recall.scheduler.SrsScheduler;
import com.gt.recall.trainer.Trainer;
import com.gt.recall.trainer.TrainerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One user's pass through a batch of due items.
 * <p>
 * State moves Empty -> Ready -> Presenting -> Ready/Empty and finally Ended. Operations are expected to be issued one
 * at a time: {@link #grade(String)} is only valid once the future returned by {@link #advance()} has completed with a
 * {@link AdvanceStatus#Presenting} result; answers arriving while the item is still being prepared are
 * rejected. The instance lock is never held while a trainer renders.
 */
public class ReviewSession {

    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    public static final int DEFAULT_MAX_QUEUE_SIZE = 20;

    private final String userId;
    private final String collectionId;
    private final int maxQueueSize;
    private final Duration renderTimeout;
    private final TrainerFactory trainerFactory;
    private final SrsScheduler scheduler;
    private final Clock clock;
    private final Instant startedAt;

    private final Deque<Item> queue = new ArrayDeque<>();
    private final List<ReviewedItem> reviewedItems = new ArrayList<>();

    private TrainerMode mode;
    private SessionState state = SessionState.Empty;
    private Item currentItem;
    private Trainer currentTrainer;
    private boolean awaitingAnswer = false;
    private int itemsReviewed = 0;
    private int correct = 0;
    private int incorrect = 0;
    private SessionSummary summary;

    public ReviewSession(String userId,
                         String collectionId,
                         TrainerMode mode,
                         int maxQueueSize,
                         Duration renderTimeout,
                         TrainerFactory trainerFactory,
                         SrsScheduler scheduler,
                         Clock clock) {
        this.userId = userId;
        this.collectionId = collectionId;
        this.mode = mode;
        this.maxQueueSize = maxQueueSize;
        this.renderTimeout = renderTimeout;
        this.trainerFactory = trainerFactory;
        this.scheduler = scheduler;
        this.clock = clock;

        this.startedAt = clock.instant();

        log.info("Created review session for user {} on collection {} with mode {}", userId, collectionId, mode);
    }

    public synchronized void loadQueue(Collection<Item> allItems, Instant now) {
        requireState("load a queue", SessionState.Empty, SessionState.Ready);

        List<Item> dueItems = allItems.stream()
                .filter(item -> scheduler.isDue(item, now))
                .toList();

        List<Item> newItems = dueItems.stream()
                .filter(Item::isNew)
                .toList();

        List<Item> backlogItems = dueItems.stream()
                .filter(item -> !item.isNew())
                .sorted(Comparator.comparing((Item item) -> item.dueTime() != null ? item.dueTime() : now))
                .toList();

        queue.clear();
        for (Item item : newItems) {
            if (queue.size() < maxQueueSize) {
                queue.addLast(item);
            }
        }
        for (Item item : backlogItems) {
            if (queue.size() < maxQueueSize) {
                queue.addLast(item);
            }
        }

        state = queue.isEmpty() ? SessionState.Empty : SessionState.Ready;

        log.info("Loaded {} due items out of {} total items for user {}", queue.size(), allItems.size(), userId);
    }

    public CompletableFuture<AdvanceResult> advance() {
        Item item;
        Trainer trainer;
        SessionProgress progress;

        synchronized (this) {
            requireState("advance", SessionState.Empty, SessionState.Ready);

            if (queue.isEmpty()) {
                state = SessionState.Empty;
                log.info("No more items in the review queue for user {}", userId);
                return CompletableFuture.completedFuture(AdvanceResult.exhausted(mode));
            }

            item = queue.pollFirst();
            trainer = trainerFactory.createTrainer(mode);

            currentItem = item;
            currentTrainer = trainer;
            state = SessionState.Presenting;
            progress = progress();
        }

        CompletableFuture<PresentationPayload> rendering;
        try {
            rendering = trainer.render(item);
        } catch (RuntimeException ex) {
            rendering = CompletableFuture.failedFuture(ex);
        }

        return rendering
                .orTimeout(renderTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((payload, ex) -> completeAdvance(item, trainer, progress, payload, ex));
    }

    private synchronized AdvanceResult completeAdvance(Item item, Trainer trainer, SessionProgress progress,
                                                       PresentationPayload payload, Throwable ex) {
        boolean stillBound = state == SessionState.Presenting && currentTrainer == trainer;

        if (ex != null) {
            String errMsg = describeRenderFailure(unwrap(ex));
            log.error("Error preparing item {} in {} mode for user {}: {}", item.id(), trainer.mode(), userId, errMsg);

            if (stillBound) {
                queue.addFirst(item);
                currentItem = null;
                currentTrainer = null;
                state = SessionState.Ready;
            }

            return AdvanceResult.failed(trainer.mode(), item.id(), errMsg);
        }

        if (!stillBound) {
            return AdvanceResult.failed(trainer.mode(), item.id(), "Session for user " + userId + " ended while the item was being prepared");
        }

        awaitingAnswer = true;

        log.debug("Prepared item {} in {} mode for user {}", item.id(), trainer.mode(), userId);
        return AdvanceResult.presenting(PresentationPayload.withProgress(payload, progress));
    }

    public synchronized ReviewResult grade(String answer) {
        if (state != SessionState.Presenting || !awaitingAnswer) {
            throw new IllegalStateException("No item is being presented to user " + userId + " (state " + state + ")");
        }

        GradeResult grade = currentTrainer.grade(answer);
        Item updatedItem = scheduler.schedule(currentItem, grade.rating(), clock.instant());

        itemsReviewed++;
        if (grade.isCorrect()) {
            correct++;
        } else {
            incorrect++;
        }
        reviewedItems.add(new ReviewedItem(updatedItem, grade.rating()));

        awaitingAnswer = false;
        currentItem = null;
        currentTrainer = null;
        state = queue.isEmpty() ? SessionState.Empty : SessionState.Ready;

        log.debug("Graded item {} for user {} with rating {}", updatedItem.id(), userId, grade.rating());

        return new ReviewResult(updatedItem, grade, progress(), queue.size());
    }

    public synchronized SessionSummary end() {
        if (summary == null) {
            Instant endedAt = clock.instant();
            double accuracy = itemsReviewed == 0 ? 0.0 : (double) correct / itemsReviewed;
            double durationSeconds = Duration.between(startedAt, endedAt).toMillis() / 1000.0;

            summary = new SessionSummary(userId, collectionId, mode, startedAt, itemsReviewed, correct, incorrect,
                    accuracy, durationSeconds);

            queue.clear();
            awaitingAnswer = false;
            currentItem = null;
            currentTrainer = null;
            state = SessionState.Ended;

            log.info("Ended review session for user {} on collection {}, reviewed {} items", userId, collectionId, itemsReviewed);
        }

        return summary;
    }

    public synchronized void changeMode(TrainerMode newMode) {
        requireState("change mode", SessionState.Empty, SessionState.Ready);

        if (!trainerFactory.isAvailable(newMode)) {
            throw new IllegalStateException("Cannot switch review session for user " + userId + " to " + newMode + ", the mode is not available");
        }

        log.info("Switching review session for user {} from {} to {}", userId, mode, newMode);
        this.mode = newMode;
    }

    public synchronized SessionProgress progress() {
        int inFlight = currentItem != null ? 1 : 0;
        return new SessionProgress(itemsReviewed + inFlight, itemsReviewed + inFlight + queue.size(), correct, incorrect);
    }

    public synchronized SessionState state() {
        return state;
    }

    public synchronized TrainerMode mode() {
        return mode;
    }

    public synchronized Optional<Item> currentItem() {
        return Optional.ofNullable(currentItem);
    }

    public synchronized List<Item> remainingItems() {
        return List.copyOf(queue);
    }

    public synchronized List<ReviewedItem> reviewedItems() {
        return List.copyOf(reviewedItems);
    }

    public String userId() {
        return userId;
    }

    public String collectionId() {
        return collectionId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    private void requireState(String operation, SessionState... allowedStates) {
        for (SessionState allowedState : allowedStates) {
            if (state == allowedState) {
                return;
            }
        }

        throw new IllegalStateException("Cannot " + operation + " for user " + userId + " while session is " + state);
    }

    private String describeRenderFailure(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return "Preparing the item timed out after " + renderTimeout.toSeconds() + " seconds";
        }

        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }

        return cause;
    }
}
