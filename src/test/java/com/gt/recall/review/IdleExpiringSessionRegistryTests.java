package com.gt.recall.review;

import com.gt.recall.generation.SentenceGenerator;
import com.gt.recall.model.*;
import com.gt.recall.reviewSession.ReviewSession;
import com.gt.recall.reviewSession.ReviewSessionRegistry;
import com.gt.recall.scheduler.SrsScheduler;
import com.gt.recall.trainer.TrainerFactory;
import com.gt.recall.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.gt.recall.util.TestUtils.TEST_COLLECTION_ID;
import static com.gt.recall.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class IdleExpiringSessionRegistryTests {

    private static final Duration IDLE_TIMEOUT = Duration.ofMinutes(30);
    private static final List<Item> TEST_ITEMS = List.of(TestUtils.newItem("1", "France", "Paris"));

    @Mock private SentenceGenerator sentenceGenerator;

    private TestUtils.MutableClock clock;
    private ReviewSessionRegistry delegate;
    private IdleExpiringSessionRegistry registry;

    @BeforeEach
    public void setup() {
        clock = new TestUtils.MutableClock(TEST_NOW);
        delegate = new ReviewSessionRegistry(new TrainerFactory(sentenceGenerator, 3, new Random(5)), new SrsScheduler(),
                clock, 20, Duration.ofSeconds(5));
        registry = new IdleExpiringSessionRegistry(delegate, clock, IDLE_TIMEOUT);
    }

    @Test
    public void testEvictIdleSessions() {
        registry.begin("idleUser", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);
        registry.begin("activeUser", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);

        clock.advance(Duration.ofMinutes(20));
        registry.get("activeUser");
        clock.advance(Duration.ofMinutes(15));

        List<SessionSummary> evicted = registry.evictIdleSessions(clock.instant());

        assertEquals(1, evicted.size());
        assertEquals("idleUser", evicted.get(0).userId());
        assertTrue(registry.get("idleUser").isEmpty());
        assertTrue(registry.get("activeUser").isPresent());
    }

    @Test
    public void testEvictIdleSessions_WithinTimeout() {
        registry.begin("user1", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);
        clock.advance(IDLE_TIMEOUT);

        assertTrue(registry.evictIdleSessions(clock.instant()).isEmpty());
        assertTrue(registry.get("user1").isPresent());
    }

    @Test
    public void testEvictIdleSessions_UntrackedSession() {
        delegate.begin("user1", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);

        assertTrue(registry.evictIdleSessions(TEST_NOW).isEmpty());
        assertEquals(1, registry.evictIdleSessions(TEST_NOW.plus(Duration.ofHours(1))).size());
        assertTrue(delegate.get("user1").isEmpty());
    }

    @Test
    public void testEvictIdleSessions_SessionReplacedDuringCheck() {
        ReviewSessionRegistry replacingDelegate = new ReviewSessionRegistry(new TrainerFactory(sentenceGenerator, 3, new Random(5)),
                new SrsScheduler(), clock, 20, Duration.ofSeconds(5)) {
            private boolean replaced = false;

            // the user ends the idle session and starts a new one just before eviction ends it
            @Override
            public Optional<SessionSummary> end(String userId, ReviewSession expected) {
                if (!replaced) {
                    replaced = true;
                    end(userId);
                    begin(userId, TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, clock.instant());
                }
                return super.end(userId, expected);
            }
        };
        IdleExpiringSessionRegistry expiringRegistry = new IdleExpiringSessionRegistry(replacingDelegate, clock, IDLE_TIMEOUT);

        expiringRegistry.begin("user1", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);
        ReviewSession idleSession = replacingDelegate.get("user1").orElseThrow();
        clock.advance(Duration.ofHours(1));

        assertTrue(expiringRegistry.evictIdleSessions(clock.instant()).isEmpty());

        ReviewSession current = replacingDelegate.get("user1").orElseThrow();
        assertNotSame(idleSession, current);
        assertEquals(SessionState.Ready, current.state());
        assertEquals(SessionState.Ended, idleSession.state());
    }

    @Test
    public void testBegin_ModeUnavailableNotTracked() {
        BeginResult result = registry.begin("user1", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.Cloze, TEST_NOW);

        assertEquals(BeginStatus.ModeUnavailable, result.status());
        assertTrue(registry.activeUsers().isEmpty());
    }

    @Test
    public void testEnd() {
        registry.begin("user1", TEST_COLLECTION_ID, TEST_ITEMS, TrainerMode.DirectRecall, TEST_NOW);

        assertTrue(registry.end("user1").isPresent());
        assertTrue(registry.activeUsers().isEmpty());
        assertTrue(registry.evictIdleSessions(TEST_NOW.plus(Duration.ofDays(1))).isEmpty());
    }

    @Test
    public void testBegin_NothingDue() {
        Item notDue = TestUtils.reviewedItem("1", "France", "Paris", 2, TEST_NOW.plus(Duration.ofDays(2)));

        BeginResult result = registry.begin("user1", TEST_COLLECTION_ID, List.of(notDue), TrainerMode.DirectRecall, TEST_NOW);

        assertEquals(BeginStatus.NothingDue, result.status());
        assertTrue(registry.activeUsers().isEmpty());
    }
}
