package com.company.reporting.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.task.ThreadPoolTaskExecutorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class AsyncConfig {

    /**
     * Bounded pool for report pipelines. Notifications use {@link #taskExecutor}.
     */
    @Bean(name = "reportExecutionExecutor")
    public ThreadPoolTaskExecutor reportExecutionExecutor(
            @Value("${reporting.execution.pool.core-size:4}") int coreSize,
            @Value("${reporting.execution.pool.max-size:8}") int maxSize,
            @Value("${reporting.execution.pool.queue-capacity:100}") int queueCapacity) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("report-exec-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Report executor configured: core={}, max={}, queue={}", coreSize, maxSize, queueCapacity);
        return executor;
    }

    /**
     * Default {@code @Async} executor (alert notifications), sized by {@code spring.task.execution.*}.
     */
    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor(ThreadPoolTaskExecutorBuilder builder) {
        return builder.build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
