package com.gt.recall.conf;

import com.gt.recall.review.IdleExpiringSessionRegistry;
import com.gt.recall.reviewSession.ReviewSessionRegistry;
import com.gt.recall.scheduler.SrsScheduler;
import com.gt.recall.trainer.TrainerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class BeanConfig {

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReviewSessionRegistry getReviewSessionRegistry(TrainerFactory trainerFactory,
                                                          SrsScheduler scheduler,
                                                          Clock clock,
                                                          @Value("${recall.review.maxQueueSize:20}") int maxQueueSize,
                                                          @Value("${recall.review.renderTimeoutSec:30}") int renderTimeoutSec) {
        return new ReviewSessionRegistry(trainerFactory, scheduler, clock, maxQueueSize, Duration.ofSeconds(renderTimeoutSec));
    }

    @Bean
    @Primary
    public IdleExpiringSessionRegistry getIdleExpiringSessionRegistry(ReviewSessionRegistry reviewSessionRegistry,
                                                                      Clock clock,
                                                                      @Value("${recall.session.idleTimeoutMinutes:30}") int idleTimeoutMinutes) {
        return new IdleExpiringSessionRegistry(reviewSessionRegistry, clock, Duration.ofMinutes(idleTimeoutMinutes));
    }
}
