package com.social.tipping.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One breaker per dependency name, created on first lookup and kept for the process lifetime.
 * Each breaker is backed by an instance of the shared Resilience4j {@link CircuitBreakerRegistry},
 * so transition events are observed through the registry's event publisher.
 */
public class CircuitBreakers {

    // OPEN -> HALF_OPEN is driven by CircuitBreaker on the injected clock, never by Resilience4j.
    private static final Duration DELEGATE_OPEN_WAIT = Duration.ofDays(365);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerRegistry registry;
    private final Function<String, CircuitBreakerOptions> optionsResolver;
    private final Clock clock;

    public CircuitBreakers(CircuitBreakerRegistry registry,
                           Function<String, CircuitBreakerOptions> optionsResolver,
                           Clock clock) {
        this.registry = registry;
        this.optionsResolver = optionsResolver;
        this.clock = clock;
    }

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreakerOptions options = optionsResolver.apply(n);
            return new CircuitBreaker(registry.circuitBreaker(n, delegateConfig(options)), options, clock);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public List<CircuitBreakerStats> all() {
        List<CircuitBreakerStats> stats = new ArrayList<>();
        for (CircuitBreaker breaker : breakers.values()) {
            stats.add(breaker.getStats());
        }
        stats.sort(Comparator.comparing(CircuitBreakerStats::name));
        return stats;
    }

    /**
     * @return false if no breaker with that name exists
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    static CircuitBreakerConfig delegateConfig(CircuitBreakerOptions options) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(options.failureThreshold())
                .minimumNumberOfCalls(options.failureThreshold())
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(options.halfOpenMaxCalls())
                .waitDurationInOpenState(DELEGATE_OPEN_WAIT)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
