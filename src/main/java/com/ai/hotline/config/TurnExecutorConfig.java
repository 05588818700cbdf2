package com.ai.hotline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pool for webhook turns.
 *
 * <p>Backend calls block for up to their read timeout, so webhook controllers hand
 * each turn to this pool and answer asynchronously instead of holding servlet threads.
 * A {@code ThreadPoolExecutor} only grows past its core size once the queue is full, so the
 * queue defaults to zero capacity: every concurrent turn gets its own thread up to
 * {@code maxPoolSize}. Beyond that the request thread runs the turn itself
 * ({@link ThreadPoolExecutor.CallerRunsPolicy}) instead of rejecting a provider webhook.
 */
@Configuration
@EnableScheduling
public class TurnExecutorConfig {

    private final HotlineProperties properties;

    public TurnExecutorConfig(HotlineProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor() {
        HotlineProperties.TurnPool pool = properties.getTurnPool();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
