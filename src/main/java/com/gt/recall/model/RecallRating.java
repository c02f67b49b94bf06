package com.gt.recall.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.recall.serialization.RecallRatingSerializer;

/**
 * SuperMemo-2 quality of recall. Scores of 3 and above count as a successful recall.
 */
@JsonSerialize(using = RecallRatingSerializer.class, as = Integer.class)
public enum RecallRating {
    CompleteBlackout(0),
    IncorrectRecognized(1),
    IncorrectFamiliar(2),
    CorrectDifficult(3),
    CorrectHesitation(4),
    PerfectRecall(5);

    public static final int SUCCESS_THRESHOLD = 3;

    private final int score;

    RecallRating(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    public boolean isSuccessful() {
        return score >= SUCCESS_THRESHOLD;
    }

    public static RecallRating fromScore(int score) {
        for (RecallRating rating : values()) {
            if (rating.score == score) {
                return rating;
            }
        }

        throw new IllegalArgumentException("Recall rating must be between 0 and 5, got " + score);
    }
}
