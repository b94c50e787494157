package com.social.tipping.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a single sliding-window rate limit check")
public class RateLimitResult {

    @Schema(description = "Scope that was checked", example = "USER")
    private RateLimitScope scope;

    @Schema(description = "Whether the request fits in the window", example = "true")
    private boolean allowed;

    @Schema(description = "Requests left in the current window", example = "42")
    private int remaining;

    @Schema(description = "Epoch millis when the oldest counted request leaves the window")
    private long resetAt;

    @Schema(description = "Seconds to wait before retrying, set only when rejected", example = "3600")
    private Long retryAfterSeconds;

    @Schema(description = "Human-readable rejection reason",
            example = "Daily tip limit reached: maximum 100 tips per 24 hours.")
    private String reason;
}
