package com.gt.recall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record Item(String id,
                   String collectionId,
                   String front,
                   String back,
                   double interval,
                   double easiness,
                   int reviewCount,
                   Instant dueTime) {

    public static final double INITIAL_INTERVAL = 1.0;
    public static final double INITIAL_EASINESS = 2.5;

    public static final double MIN_INTERVAL = 0.2;
    public static final double MIN_EASINESS = 1.3;
    public static final double MAX_EASINESS = 5.0;

    public Item {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(front, "front");
        Objects.requireNonNull(back, "back");

        if (reviewCount < 0) {
            throw new IllegalArgumentException("Review count cannot be negative for item " + id);
        }
        if (!(interval >= MIN_INTERVAL)) {
            throw new IllegalArgumentException("Interval must be at least " + MIN_INTERVAL + " days for item " + id + ", got " + interval);
        }
        if (!(easiness >= MIN_EASINESS && easiness <= MAX_EASINESS)) {
            throw new IllegalArgumentException("Easiness must be between " + MIN_EASINESS + " and " + MAX_EASINESS + " for item " + id + ", got " + easiness);
        }
    }

    // Scheduling fields left out of a request describe a fresh item
    @JsonCreator
    public static Item fromJson(@JsonProperty("id") String id,
                                @JsonProperty("collectionId") String collectionId,
                                @JsonProperty("front") String front,
                                @JsonProperty("back") String back,
                                @JsonProperty("interval") Double interval,
                                @JsonProperty("easiness") Double easiness,
                                @JsonProperty("reviewCount") Integer reviewCount,
                                @JsonProperty("dueTime") Instant dueTime) {
        return new Item(id, collectionId, front, back,
                interval != null ? interval : INITIAL_INTERVAL,
                easiness != null ? easiness : INITIAL_EASINESS,
                reviewCount != null ? reviewCount : 0,
                dueTime);
    }

    public static Item newItem(String id, String collectionId, String front, String back) {
        return new Item(id, collectionId, front, back, INITIAL_INTERVAL, INITIAL_EASINESS, 0, null);
    }

    public static Item withSchedule(Item item, double interval, double easiness, int reviewCount, Instant dueTime) {
        return new Item(item.id, item.collectionId, item.front, item.back, interval, easiness, reviewCount, dueTime);
    }

    public boolean isNew() {
        return reviewCount == 0;
    }
}
