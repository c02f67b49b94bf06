package com.gt.recall.model;

public record ReviewResult(Item updatedItem,
                           GradeResult grade,
                           SessionProgress progress,
                           int itemsRemaining) { }
