package com.gt.recall.trainer;

import com.gt.recall.model.GradeResult;
import com.gt.recall.model.Item;
import com.gt.recall.model.PresentationPayload;
import com.gt.recall.model.TrainerMode;

import java.util.concurrent.CompletableFuture;

/**
 * Presentation and grading strategy for one review mode. An instance is bound to the item passed to
 * {@link #render(Item)} and grades answers for that item only.
 */
public interface Trainer {

    TrainerMode mode();

    /**
     * Binds the trainer to {@code item} and builds the content shown to the learner. Modes that call out to a
     * collaborator complete the future asynchronously; the others return an already completed future.
     */
    CompletableFuture<PresentationPayload> render(Item item);

    /**
     * Grades a raw answer for the bound item.
     *
     * @throws IllegalStateException if no item has been rendered yet
     */
    GradeResult grade(String answer);
}
