package com.eventfacts.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for per-occurrence sample fetches. Sized to the batch size, so one
 * batch never has more requests in flight than the pool has threads.
 */
@Configuration
public class IngestionConfig {

    @Bean
    public ThreadPoolTaskExecutor ingestionExecutor(@Value("${app.ingestion.batch-size:10}") int batchSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchSize);
        executor.setMaxPoolSize(batchSize);
        executor.setThreadNamePrefix("ingestion-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
