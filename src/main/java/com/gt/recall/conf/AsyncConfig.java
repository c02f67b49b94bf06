package com.gt.recall.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    // Runs the blocking calls to the sentence generation API
    @Bean(name = "generationExecutor")
    public Executor generationExecutor(@Value("${recall.async.generation.corePoolSize:2}") int corePoolSize,
                                       @Value("${recall.async.generation.maxPoolSize:4}") int maxPoolSize,
                                       @Value("${recall.async.generation.queueCapacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("generation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Generation executor configured - Core: {}, Max: {}, Queue: {}", corePoolSize, maxPoolSize, queueCapacity);

        return executor;
    }
}
