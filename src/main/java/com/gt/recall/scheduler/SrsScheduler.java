package com.gt.recall.scheduler;

import com.gt.recall.model.Item;
import com.gt.recall.model.RecallRating;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * SuperMemo-2 scheduling. Stateless; every call returns a new {@link Item} and leaves the argument untouched.
 */
@Component
public class SrsScheduler {

    static final double MIN_EASINESS = Item.MIN_EASINESS;
    static final double MAX_EASINESS = Item.MAX_EASINESS;
    static final double MIN_INTERVAL = Item.MIN_INTERVAL;
    static final double FAILED_INTERVAL_MODIFIER = 0.2;
    static final double FIRST_SUCCESS_INTERVAL = 1.0;
    static final double SECOND_SUCCESS_INTERVAL = 6.0;

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public Item schedule(Item item, int score, Instant now) {
        return schedule(item, RecallRating.fromScore(score), now);
    }

    public Item schedule(Item item, RecallRating rating, Instant now) {
        int reviewCount = item.reviewCount() + 1;
        int q = rating.getScore();

        double easinessDelta = 0.1 - (5 - q) * (0.08 + (5 - q) * 0.02);
        double easiness = clamp(item.easiness() + easinessDelta, MIN_EASINESS, MAX_EASINESS);

        // interval growth uses the easiness the item had before this review
        double interval;
        if (!rating.isSuccessful()) {
            interval = Math.max(MIN_INTERVAL, item.interval() * FAILED_INTERVAL_MODIFIER);
        } else if (reviewCount == 1) {
            interval = FIRST_SUCCESS_INTERVAL;
        } else if (reviewCount == 2) {
            interval = SECOND_SUCCESS_INTERVAL;
        } else {
            interval = item.interval() * item.easiness();
        }

        return Item.withSchedule(item, interval, easiness, reviewCount, plusDays(now, interval));
    }

    public boolean isDue(Item item, Instant now) {
        return item.dueTime() == null || !item.dueTime().isAfter(now);
    }

    public Item reset(Item item, Instant now) {
        return Item.withSchedule(item, Item.INITIAL_INTERVAL, Item.INITIAL_EASINESS, 0, plusDays(now, 1.0));
    }

    public Map<RecallRating, Instant> previewDueTimes(Item item, Instant now) {
        Map<RecallRating, Instant> dueTimes = new EnumMap<>(RecallRating.class);
        for (RecallRating rating : RecallRating.values()) {
            dueTimes.put(rating, schedule(item, rating, now).dueTime());
        }

        return dueTimes;
    }

    static Instant plusDays(Instant instant, double days) {
        return instant.plus(Duration.ofMillis(Math.round(days * MILLIS_PER_DAY)));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
