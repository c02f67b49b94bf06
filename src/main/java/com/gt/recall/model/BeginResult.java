package com.gt.recall.model;

public record BeginResult(BeginStatus status,
                          String userId,
                          String collectionId,
                          TrainerMode mode,
                          int itemsDue) { }
