package com.social.tipping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "tip-queue")
public class TipQueueConfig {

    // Jobs processed at the same time by this instance.
    private int concurrency = 10;

    // Dequeue rate cap across the worker pool.
    private int maxJobsPerSecond = 100;

    private int maxAttempts = 3;

    // Retry delay = base * 2^(attempt - 1).
    private long backoffBaseMs = 2000;

    // An ACTIVE job whose lock is older than this is treated as stalled.
    private long lockDurationMs = 30_000;

    private long stallCheckIntervalMs = 5000;

    private int completedRetentionSeconds = 86_400;

    private int failedRetentionSeconds = 7 * 86_400;
}
