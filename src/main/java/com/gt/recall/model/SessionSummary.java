package com.gt.recall.model;

import java.time.Instant;

public record SessionSummary(String userId,
                             String collectionId,
                             TrainerMode mode,
                             Instant startedAt,
                             int itemsReviewed,
                             int correct,
                             int incorrect,
                             double accuracy,
                             double durationSeconds) { }
