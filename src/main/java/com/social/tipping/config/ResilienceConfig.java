package com.social.tipping.config;

import com.social.tipping.resilience.CircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Resilience4j registry backing every dependency breaker. State transitions of each breaker
     * are counted as they are published.
     */
    @Bean
    public CircuitBreakerRegistry resilience4jCircuitBreakerRegistry(MetricsConfig metricsConfig) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.getEventPublisher().onEntryAdded(added -> {
            CircuitBreaker breaker = added.getAddedEntry();
            breaker.getEventPublisher().onStateTransition(event -> {
                CircuitBreaker.State to = event.getStateTransition().getToState();
                log.info("Circuit breaker '{}' state transition: {}", event.getCircuitBreakerName(),
                        event.getStateTransition());
                metricsConfig.recordBreakerTransition(event.getCircuitBreakerName(),
                        to == CircuitBreaker.State.FORCED_OPEN ? "OPEN" : to.name());
            });
        });
        return registry;
    }

    @Bean
    public CircuitBreakers circuitBreakers(CircuitBreakerRegistry resilience4jCircuitBreakerRegistry,
                                           CircuitBreakerProperties properties,
                                           Clock clock) {
        CircuitBreakers breakers = new CircuitBreakers(resilience4jCircuitBreakerRegistry,
                properties::optionsFor, clock);
        properties.getInstances().keySet().forEach(breakers::get);
        log.info("Circuit breakers initialized: {}", properties.getInstances().keySet());
        return breakers;
    }

    /**
     * Caps how fast workers take jobs off the queue. A dispatch that finds no permit is pushed back
     * to the scheduler instead of holding a worker thread.
     */
    @Bean(name = "dequeueRateLimiter")
    public RateLimiter dequeueRateLimiter(TipQueueConfig queueConfig) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, queueConfig.getMaxJobsPerSecond()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("tip-dequeue", config);
    }
}
