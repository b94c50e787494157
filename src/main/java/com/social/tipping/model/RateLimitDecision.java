package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Outcome of checking every scope for one tip.
 */
@Data
@AllArgsConstructor
public class RateLimitDecision {

    private List<RateLimitResult> results;

    // First rejecting scope in evaluation order, null when every scope allowed.
    private RateLimitResult rejection;

    public boolean isAllowed() {
        return rejection == null;
    }

    public static RateLimitDecision of(List<RateLimitResult> results) {
        RateLimitResult rejection = results.stream()
                .filter(r -> !r.isAllowed())
                .findFirst()
                .orElse(null);
        return new RateLimitDecision(results, rejection);
    }
}
