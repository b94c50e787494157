package com.social.tipping.resilience;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Point-in-time view of a circuit breaker")
public record CircuitBreakerStats(
        @Schema(description = "Breaker name", example = "settlement") String name,
        @Schema(description = "Current state", example = "CLOSED") CircuitState state,
        @Schema(description = "Failures inside the monitoring window", example = "1") int failureCount,
        @Schema(description = "Epoch millis of the last failure, 0 if none") long lastFailureTime,
        @Schema(description = "Calls admitted while half-open", example = "0") int halfOpenCalls) {
}
