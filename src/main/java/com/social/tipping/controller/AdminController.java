package com.social.tipping.controller;

import com.social.tipping.engine.AbuseDetector;
import com.social.tipping.model.FailedTipJob;
import com.social.tipping.model.QueueStats;
import com.social.tipping.model.RateLimitScope;
import com.social.tipping.model.RateLimitStatus;
import com.social.tipping.model.TipJob;
import com.social.tipping.model.VerificationTier;
import com.social.tipping.resilience.CircuitBreakers;
import com.social.tipping.resilience.CircuitBreakerStats;
import com.social.tipping.service.RateLimitService;
import com.social.tipping.service.TipJobQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Administration", description = "Queue inspection, dead letters, circuit breakers and limit resets")
public class AdminController {

    private final TipJobQueue jobQueue;
    private final CircuitBreakers breakers;
    private final RateLimitService rateLimitService;
    private final AbuseDetector abuseDetector;

    public AdminController(TipJobQueue jobQueue,
                           CircuitBreakers breakers,
                           RateLimitService rateLimitService,
                           AbuseDetector abuseDetector) {
        this.jobQueue = jobQueue;
        this.breakers = breakers;
        this.rateLimitService = rateLimitService;
        this.abuseDetector = abuseDetector;
    }

    @GetMapping("/queue/stats")
    @Operation(summary = "Get queue statistics", description = "Job counts per status plus jobs running in this instance")
    public ResponseEntity<QueueStats> getQueueStats() {
        return ResponseEntity.ok(jobQueue.getStats());
    }

    @GetMapping("/queue/failed")
    @Operation(summary = "List dead-lettered jobs", description = "Most recent failures first")
    public ResponseEntity<List<FailedTipJob>> getFailedJobs(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(jobQueue.getFailedJobs(limit));
    }

    @PostMapping("/queue/failed/{jobId}/retry")
    @Operation(summary = "Retry a dead-lettered job",
               description = "Moves the job back to WAITING with a fresh attempt budget")
    public ResponseEntity<TipJob> retryFailedJob(@PathVariable String jobId) {
        TipJob job = jobQueue.retryFailed(jobId);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(job);
    }

    @GetMapping("/circuit-breakers")
    @Operation(summary = "List circuit breakers", description = "State and counters of every breaker")
    public ResponseEntity<List<CircuitBreakerStats>> getCircuitBreakers() {
        return ResponseEntity.ok(breakers.all());
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    @Operation(summary = "Reset a circuit breaker", description = "Forces the breaker back to CLOSED")
    public ResponseEntity<?> resetCircuitBreaker(@PathVariable String name) {
        if (!breakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("name", name, "state", "CLOSED"));
    }

    @GetMapping("/rate-limits/{scope}/{subject}")
    @Operation(summary = "Inspect a rate limit window")
    public ResponseEntity<RateLimitStatus> getRateLimit(
            @Parameter(description = "user, ip, wallet, amount or notify", example = "user")
            @PathVariable String scope,
            @PathVariable String subject,
            @RequestParam(defaultValue = "UNVERIFIED") VerificationTier tier) {
        return ResponseEntity.ok(rateLimitService.getStatus(RateLimitScope.fromName(scope), subject, tier));
    }

    @DeleteMapping("/rate-limits/{scope}/{subject}")
    @Operation(summary = "Clear a rate limit", description = "Drops the window and any block for the key")
    public ResponseEntity<Void> clearRateLimit(@PathVariable String scope, @PathVariable String subject) {
        rateLimitService.clearLimit(RateLimitScope.fromName(scope), subject);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/abuse/{userId}")
    @Operation(summary = "Clear abuse signals", description = "Resets velocity and amount history of a sender")
    public ResponseEntity<Void> clearAbuseSignals(@PathVariable String userId) {
        abuseDetector.clearUserSignals(userId);
        return ResponseEntity.noContent().build();
    }
}
