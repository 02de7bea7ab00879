package com.chainfeed.merge.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Merge tuning. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chainfeed.merge")
@NoArgsConstructor
@Getter
@Setter
public class MergeProperties {

    /** Consecutive rounds without output before a takeN call fails as stalled. Default 3. */
    private int maxEmptyRounds = 3;

    /**
     * Threads of merge-peek-executor; one peek per stream runs on it each round. Every thread is started
     * before peeks queue, so a round stays as slow as its slowest peek while fewer peeks than this are in flight.
     */
    private int peekPoolSize = 16;

    /** Peeks waiting for a free thread; beyond that they are rejected and fail the merge call. */
    private int peekQueueCapacity = 256;
}
