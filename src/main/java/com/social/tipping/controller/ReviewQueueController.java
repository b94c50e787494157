package com.social.tipping.controller;

import com.social.tipping.model.PagedResponse;
import com.social.tipping.model.ReviewStatus;
import com.social.tipping.model.TipReviewItem;
import com.social.tipping.service.TipReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/review")
@Tag(name = "Review Queue", description = "Operator queue for tips flagged as unusual")
public class ReviewQueueController {

    private final TipReviewService reviewService;

    public ReviewQueueController(TipReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @GetMapping("/queue")
    @Operation(summary = "List review queue items",
               description = "Flagged tips, newest first. Filter by status and sender; page with the before cursor.")
    public ResponseEntity<PagedResponse<TipReviewItem>> getQueueItems(
            @RequestParam(required = false) ReviewStatus status,
            @RequestParam(required = false) String senderId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(reviewService.getQueueItems(status, senderId, limit, before));
    }

    @GetMapping("/queue/{jobId}")
    @Operation(summary = "Get a review queue item")
    public ResponseEntity<TipReviewItem> getQueueItem(@PathVariable String jobId) {
        TipReviewItem item = reviewService.getItem(jobId);
        if (item == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(item);
    }

    @PostMapping("/queue/{jobId}/resolve")
    @Operation(summary = "Resolve a review queue item",
               description = "Mark a flagged tip as CLEARED or CONFIRMED_ABUSE")
    public ResponseEntity<?> resolve(@PathVariable String jobId, @RequestBody Map<String, String> body) {
        String status = body.get("status");
        String reviewedBy = body.getOrDefault("reviewedBy", "ops");

        if (status == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }

        try {
            ReviewStatus reviewStatus = ReviewStatus.valueOf(status.toUpperCase());
            TipReviewItem updated = reviewService.resolve(jobId, reviewStatus, reviewedBy);
            if (updated == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(updated);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/stats")
    @Operation(summary = "Get review queue statistics", description = "Counts by review status")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(reviewService.getStats());
    }
}
