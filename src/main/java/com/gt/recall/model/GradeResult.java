package com.gt.recall.model;

public record GradeResult(RecallRating rating,
                          boolean isCorrect,
                          String correctAnswer,
                          String userAnswer,
                          Double similarity,
                          Integer correctOptionIndex) {

    public static GradeResult of(RecallRating rating, String correctAnswer, String userAnswer) {
        return new GradeResult(rating, rating.isSuccessful(), correctAnswer, userAnswer, null, null);
    }
}
