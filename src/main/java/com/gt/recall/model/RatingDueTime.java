package com.gt.recall.model;

import java.time.Instant;

public record RatingDueTime(RecallRating rating, Instant dueTime) { }
