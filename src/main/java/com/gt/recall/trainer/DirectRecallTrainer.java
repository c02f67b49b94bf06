package com.gt.recall.trainer;

import com.gt.recall.model.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

// The learner reveals the back on their own and reports a 0-5 score as the answer
public class DirectRecallTrainer implements Trainer {

    static final String PROMPT = "Recall the answer to this flashcard:";

    private Item item;

    @Override
    public TrainerMode mode() {
        return TrainerMode.DirectRecall;
    }

    @Override
    public CompletableFuture<PresentationPayload> render(Item item) {
        this.item = item;

        return CompletableFuture.completedFuture(
                new PresentationPayload(TrainerMode.DirectRecall, item.id(), item.front(), PROMPT, null, List.of(), null));
    }

    @Override
    public GradeResult grade(String answer) {
        if (item == null) {
            throw new IllegalStateException("No item has been rendered for grading");
        }

        return GradeResult.of(parseRating(answer), item.back(), answer);
    }

    static RecallRating parseRating(String answer) {
        if (answer == null) {
            return RecallRating.CompleteBlackout;
        }

        try {
            int score = Integer.parseInt(answer.strip());
            if (score < 0 || score > 5) {
                return RecallRating.CompleteBlackout;
            }

            return RecallRating.fromScore(score);
        } catch (NumberFormatException ex) {
            return RecallRating.CompleteBlackout;
        }
    }
}
