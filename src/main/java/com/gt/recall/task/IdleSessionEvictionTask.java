package com.gt.recall.task;

import com.gt.recall.model.SessionSummary;
import com.gt.recall.review.IdleExpiringSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class IdleSessionEvictionTask {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionEvictionTask.class);

    private final IdleExpiringSessionRegistry sessionRegistry;
    private final Clock clock;

    public IdleSessionEvictionTask(IdleExpiringSessionRegistry sessionRegistry, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${recall.session.evictionCheckMs:60000}")
    public void evictIdleSessions() {
        List<SessionSummary> evicted = sessionRegistry.evictIdleSessions(clock.instant());

        if (!evicted.isEmpty()) {
            log.info("Evicted idle review sessions. {} session(s) ended.", evicted.size());
        }
    }
}
