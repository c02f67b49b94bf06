package com.gt.recall.scheduler;

import com.gt.recall.model.Item;
import com.gt.recall.model.RecallRating;
import com.gt.recall.util.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.gt.recall.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

public class SrsSchedulerTests {

    private static final double DELTA = 1e-9;

    private final SrsScheduler scheduler = new SrsScheduler();

    @Test
    public void testSchedule_FirstSuccess() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        Item updated = scheduler.schedule(item, RecallRating.PerfectRecall, TEST_NOW);

        assertEquals(1.0, updated.interval(), DELTA);
        assertEquals(2.6, updated.easiness(), DELTA);
        assertEquals(1, updated.reviewCount());
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), updated.dueTime());

        // the argument is untouched
        assertEquals(0, item.reviewCount());
        assertNull(item.dueTime());
    }

    @Test
    public void testSchedule_IntervalGrowth() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        Item first = scheduler.schedule(item, RecallRating.CorrectHesitation, TEST_NOW);
        Item second = scheduler.schedule(first, RecallRating.CorrectHesitation, TEST_NOW);
        Item third = scheduler.schedule(second, RecallRating.CorrectHesitation, TEST_NOW);

        assertEquals(1.0, first.interval(), DELTA);
        assertEquals(6.0, second.interval(), DELTA);
        assertEquals(6.0 * second.easiness(), third.interval(), DELTA);
        assertEquals(2.5, third.easiness(), DELTA);
        assertEquals(3, third.reviewCount());
        assertEquals(TEST_NOW.plus(Duration.ofDays(15)), third.dueTime());
    }

    @Test
    public void testSchedule_PerfectRecallGrowth() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        Item first = scheduler.schedule(item, RecallRating.PerfectRecall, TEST_NOW);
        Item second = scheduler.schedule(first, RecallRating.PerfectRecall, TEST_NOW);
        Item third = scheduler.schedule(second, RecallRating.PerfectRecall, TEST_NOW);

        assertEquals(1.0, first.interval(), DELTA);
        assertEquals(6.0, second.interval(), DELTA);
        assertEquals(6.0 * second.easiness(), third.interval(), DELTA);

        assertTrue(item.easiness() < first.easiness());
        assertTrue(first.easiness() < second.easiness());
        assertTrue(second.easiness() < third.easiness());
    }

    @Test
    public void testSchedule_BlackoutAfterLongInterval() {
        Item item = TestUtils.reviewedItem("1", "France", "Paris", 2, TEST_NOW);

        Item updated = scheduler.schedule(item, RecallRating.CompleteBlackout, TEST_NOW);

        assertEquals(1.2, updated.interval(), DELTA);
        assertTrue(updated.easiness() < item.easiness());
        assertEquals(1.7, updated.easiness(), DELTA);
    }

    @Test
    public void testSchedule_BoundsOverReviewSequence() {
        int[] scores = { 5, 5, 0, 1, 2, 0, 0, 0, 3, 4, 5, 1, 0, 5, 4, 3, 2, 1, 0, 0, 5, 5, 5, 0 };

        Item item = TestUtils.newItem("1", "France", "Paris");
        for (int round = 0; round < 5; round++) {
            for (int score : scores) {
                item = scheduler.schedule(item, score, TEST_NOW);

                assertTrue(item.interval() >= SrsScheduler.MIN_INTERVAL, "interval " + item.interval());
                assertTrue(item.easiness() >= SrsScheduler.MIN_EASINESS, "easiness " + item.easiness());
                assertTrue(item.easiness() <= SrsScheduler.MAX_EASINESS, "easiness " + item.easiness());
                assertFalse(item.dueTime().isBefore(TEST_NOW));
            }
        }
        assertEquals(5 * scores.length, item.reviewCount());
    }

    @Test
    public void testSchedule_GrowthUsesPreviousEasiness() {
        Item item = TestUtils.reviewedItem("1", "France", "Paris", 2, TEST_NOW);

        Item updated = scheduler.schedule(item, RecallRating.PerfectRecall, TEST_NOW);

        assertEquals(15.0, updated.interval(), DELTA);
        assertEquals(2.6, updated.easiness(), DELTA);
    }

    @Test
    public void testSchedule_Failure() {
        Item item = TestUtils.reviewedItem("1", "France", "Paris", 4, TEST_NOW);

        Item updated = scheduler.schedule(item, RecallRating.IncorrectFamiliar, TEST_NOW);

        assertEquals(1.2, updated.interval(), DELTA);
        assertEquals(2.18, updated.easiness(), DELTA);
        assertEquals(5, updated.reviewCount());
        assertEquals(TEST_NOW.plus(Duration.ofMillis(Math.round(1.2 * Duration.ofDays(1).toMillis()))), updated.dueTime());
    }

    @Test
    public void testSchedule_FailureIntervalFloor() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        Item updated = scheduler.schedule(item, RecallRating.CompleteBlackout, TEST_NOW);

        assertEquals(SrsScheduler.MIN_INTERVAL, updated.interval(), DELTA);
    }

    @Test
    public void testSchedule_EasinessBounds() {
        Item item = TestUtils.newItem("1", "France", "Paris");
        for (int i = 0; i < 20; i++) {
            item = scheduler.schedule(Item.withSchedule(item, 1.0, item.easiness(), 0, null), RecallRating.CompleteBlackout, TEST_NOW);
            assertTrue(item.easiness() >= SrsScheduler.MIN_EASINESS);
        }
        assertEquals(SrsScheduler.MIN_EASINESS, item.easiness(), DELTA);

        for (int i = 0; i < 40; i++) {
            item = scheduler.schedule(Item.withSchedule(item, 1.0, item.easiness(), 0, null), RecallRating.PerfectRecall, TEST_NOW);
            assertTrue(item.easiness() <= SrsScheduler.MAX_EASINESS);
        }
        assertEquals(SrsScheduler.MAX_EASINESS, item.easiness(), DELTA);
    }

    @Test
    public void testSchedule_ScoreOutOfRange() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(item, 6, TEST_NOW));
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(item, -1, TEST_NOW));
    }

    @Test
    public void testSchedule_ByScore() {
        Item item = TestUtils.newItem("1", "France", "Paris");

        assertEquals(scheduler.schedule(item, RecallRating.CorrectDifficult, TEST_NOW),
                scheduler.schedule(item, 3, TEST_NOW));
    }

    @Test
    public void testIsDue() {
        assertTrue(scheduler.isDue(TestUtils.newItem("1", "France", "Paris"), TEST_NOW));
        assertTrue(scheduler.isDue(TestUtils.reviewedItem("2", "Spain", "Madrid", 1, TEST_NOW), TEST_NOW));
        assertTrue(scheduler.isDue(TestUtils.reviewedItem("3", "Italy", "Rome", 1, TEST_NOW.minusSeconds(60)), TEST_NOW));
        assertFalse(scheduler.isDue(TestUtils.reviewedItem("4", "Peru", "Lima", 1, TEST_NOW.plusSeconds(1)), TEST_NOW));
    }

    @Test
    public void testReset() {
        Item item = new Item("1", "capitals", "France", "Paris", 40.0, 1.4, 9, TEST_NOW.minusSeconds(5));

        Item reset = scheduler.reset(item, TEST_NOW);

        assertEquals(Item.INITIAL_INTERVAL, reset.interval(), DELTA);
        assertEquals(Item.INITIAL_EASINESS, reset.easiness(), DELTA);
        assertEquals(0, reset.reviewCount());
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), reset.dueTime());
        assertEquals("Paris", reset.back());
    }

    @Test
    public void testPreviewDueTimes() {
        Item item = TestUtils.reviewedItem("1", "France", "Paris", 2, TEST_NOW);

        Map<RecallRating, Instant> preview = scheduler.previewDueTimes(item, TEST_NOW);

        assertEquals(RecallRating.values().length, preview.size());
        for (RecallRating rating : RecallRating.values()) {
            assertEquals(scheduler.schedule(item, rating, TEST_NOW).dueTime(), preview.get(rating));
        }
        assertTrue(preview.get(RecallRating.CompleteBlackout).isBefore(preview.get(RecallRating.PerfectRecall)));
        assertEquals(2, item.reviewCount());
    }
}
