package com.chainfeed.config;

import com.chainfeed.merge.config.MergeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. merge-peek-executor runs the per-round peek fan-out of every merge call.
 */
@Configuration
public class AsyncConfig {

    public static final String MERGE_PEEK_EXECUTOR = "merge-peek-executor";

    @Bean(name = MERGE_PEEK_EXECUTOR)
    public Executor mergePeekExecutor(MergeProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        // a ThreadPoolExecutor only grows past its core size once the queue is full
        int size = Math.max(1, properties.getPeekPoolSize());
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setAllowCoreThreadTimeOut(true);
        e.setQueueCapacity(Math.max(0, properties.getPeekQueueCapacity()));
        e.setThreadNamePrefix("merge-peek-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
