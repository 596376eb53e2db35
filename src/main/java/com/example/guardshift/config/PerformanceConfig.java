package com.example.guardshift.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class PerformanceConfig {

    /**
     * Pool for schedule generation. Submissions beyond the queue capacity are rejected.
     */
    @Bean(name = "scheduleExecutor")
    public Executor scheduleExecutor(
            @Value("${shift.schedule.executor.core-size:2}") int coreSize,
            @Value("${shift.schedule.executor.max-size:4}") int maxSize,
            @Value("${shift.schedule.executor.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Schedule-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
