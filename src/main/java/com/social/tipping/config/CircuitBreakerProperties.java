package com.social.tipping.config;

import com.social.tipping.resilience.CircuitBreakerOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "circuit-breaker")
public class CircuitBreakerProperties {

    private Options defaults = new Options(5, 60_000L, 60_000L, 3);

    // Named breakers; unset fields fall back to the defaults.
    private Map<String, Options> instances = new LinkedHashMap<>(Map.of(
            "settlement", new Options(3, 60_000L, null, null),
            "content-storage", new Options(5, 30_000L, null, null),
            "moderation", new Options(5, 30_000L, null, null),
            "database", new Options(10, 10_000L, null, null),
            "notification", new Options(5, 30_000L, null, null),
            "user-directory", new Options(5, 30_000L, null, null)));

    public CircuitBreakerOptions defaultOptions() {
        return defaults.toOptions(CircuitBreakerOptions.defaults());
    }

    public CircuitBreakerOptions optionsFor(String name) {
        Options options = instances.get(name);
        CircuitBreakerOptions base = defaultOptions();
        return options == null ? base : options.toOptions(base);
    }

    @Data
    public static class Options {
        private Integer failureThreshold;
        private Long resetTimeoutMs;
        private Long monitoringPeriodMs;
        private Integer halfOpenMaxCalls;

        public Options() {
        }

        public Options(Integer failureThreshold, Long resetTimeoutMs,
                       Long monitoringPeriodMs, Integer halfOpenMaxCalls) {
            this.failureThreshold = failureThreshold;
            this.resetTimeoutMs = resetTimeoutMs;
            this.monitoringPeriodMs = monitoringPeriodMs;
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }

        CircuitBreakerOptions toOptions(CircuitBreakerOptions base) {
            return new CircuitBreakerOptions(
                    failureThreshold != null ? failureThreshold : base.failureThreshold(),
                    resetTimeoutMs != null ? resetTimeoutMs : base.resetTimeoutMs(),
                    monitoringPeriodMs != null ? monitoringPeriodMs : base.monitoringPeriodMs(),
                    halfOpenMaxCalls != null ? halfOpenMaxCalls : base.halfOpenMaxCalls());
        }
    }
}
