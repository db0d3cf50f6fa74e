package com.scholarly.citegraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for traversal work.
 *
 * <ul>
 *   <li>{@code traversalExecutor}: fixed worker pool shared by all traversals; each task performs the
 *   forward and backward lookup of one identifier.</li>
 *   <li>{@code traversalJobExecutor}: runs {@code @Async} traversal jobs, which coordinate the workers.</li>
 * </ul>
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Value("${citegraph.traversal.workers:4}")
    private int workers;

    @Value("${citegraph.jobs.concurrency:2}")
    private int jobConcurrency;

    @Bean(name = "traversalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService traversalExecutor() {
        int size = Math.max(1, workers);
        log.info("[Async Config] Traversal worker pool size: {}", size);
        return Executors.newFixedThreadPool(size, new CustomizableThreadFactory("traversal-worker-"));
    }

    @Bean(name = "traversalJobExecutor")
    public ThreadPoolTaskExecutor traversalJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, jobConcurrency));
        executor.setMaxPoolSize(Math.max(1, jobConcurrency));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("traversal-job-");
        executor.initialize();
        return executor;
    }
}
