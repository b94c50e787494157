package com.social.tipping.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Named thread pools. Each concern gets its own pool so a slow dependency in one cannot starve
 * the others.
 */
@Configuration
public class AsyncConfig {

    public static final String ABUSE_CHECK_EXECUTOR = "abuseCheckExecutor";
    public static final String TIP_WORKER_EXECUTOR = "tipWorkerExecutor";
    public static final String TIP_RETRY_SCHEDULER = "tipRetryScheduler";
    public static final String ENRICHMENT_EXECUTOR = "enrichmentExecutor";
    public static final String LEDGER_EXECUTOR = "ledgerExecutor";

    @Bean(name = ABUSE_CHECK_EXECUTOR)
    public ThreadPoolTaskExecutor abuseCheckExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(32);
        e.setQueueCapacity(1000);
        e.setThreadNamePrefix("abuse-check-");
        e.initialize();
        return e;
    }

    /** Pool size is the worker concurrency of the tip queue. */
    @Bean(name = TIP_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor tipWorkerExecutor(TipQueueConfig tipQueueConfig) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(tipQueueConfig.getConcurrency());
        e.setMaxPoolSize(tipQueueConfig.getConcurrency());
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("tip-worker-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    /** Delayed retries and the stalled-job sweep. */
    @Bean(name = TIP_RETRY_SCHEDULER)
    public ThreadPoolTaskScheduler tipRetryScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("tip-scheduler-");
        s.initialize();
        return s;
    }

    @Bean(name = ENRICHMENT_EXECUTOR)
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("enrichment-");
        e.initialize();
        return e;
    }

    @Bean(name = LEDGER_EXECUTOR)
    public ThreadPoolTaskExecutor ledgerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(1000);
        e.setThreadNamePrefix("ledger-");
        e.initialize();
        return e;
    }
}
