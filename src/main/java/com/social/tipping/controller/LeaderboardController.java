package com.social.tipping.controller;

import com.social.tipping.model.AchievementMilestone;
import com.social.tipping.model.LeaderboardCategory;
import com.social.tipping.model.LeaderboardPage;
import com.social.tipping.model.LeaderboardPeriod;
import com.social.tipping.model.TipLedgerEntry;
import com.social.tipping.model.UserStatSnapshot;
import com.social.tipping.service.AchievementEnrichment;
import com.social.tipping.service.LeaderboardService;
import com.social.tipping.service.TipLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Leaderboards", description = "Top senders and recipients, per-user totals and tip history")
public class LeaderboardController {

    private final LeaderboardService leaderboardService;
    private final TipLedgerService ledgerService;
    private final AchievementEnrichment achievements;

    public LeaderboardController(LeaderboardService leaderboardService,
                                 TipLedgerService ledgerService,
                                 AchievementEnrichment achievements) {
        this.leaderboardService = leaderboardService;
        this.ledgerService = ledgerService;
        this.achievements = achievements;
    }

    @Operation(summary = "Get a leaderboard",
            description = "Returns the top users by tipped amount for the all-time or current ISO-week period.")
    @GetMapping("/leaderboard/{period}")
    public ResponseEntity<LeaderboardPage> getLeaderboard(
            @Parameter(description = "all or weekly", example = "weekly")
            @PathVariable String period,
            @Parameter(description = "senders or recipients", example = "senders")
            @RequestParam(defaultValue = "senders") String category,
            @Parameter(description = "Number of entries, capped at the configured maximum", example = "10")
            @RequestParam(required = false) Integer limit) {
        LeaderboardPage page = leaderboardService.getLeaderboard(
                LeaderboardPeriod.fromPath(period), LeaderboardCategory.fromParam(category), limit);
        return ResponseEntity.ok(page);
    }

    @Operation(summary = "Count leaderboard entries",
            description = "Number of users with at least one tip in the period and category.")
    @GetMapping("/leaderboard/{period}/count")
    public ResponseEntity<Map<String, Object>> countEntries(
            @PathVariable String period,
            @RequestParam(defaultValue = "senders") String category) {
        LeaderboardPeriod p = LeaderboardPeriod.fromPath(period);
        LeaderboardCategory c = LeaderboardCategory.fromParam(category);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("period", p);
        body.put("category", c);
        body.put("totalCount", leaderboardService.getTotalCount(p, c));
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get user tipping stats",
            description = "Returns totals sent and received, the current week's totals and sender ranks.")
    @GetMapping("/users/{userId}/stats")
    public ResponseEntity<UserStatSnapshot> getUserStats(@PathVariable String userId) {
        return ResponseEntity.ok(leaderboardService.getUserStats(userId));
    }

    @Operation(summary = "Get user tip history",
            description = "Settled tips sent or received by the user, newest first.")
    @GetMapping("/users/{userId}/ledger")
    public ResponseEntity<Page<TipLedgerEntry>> getLedger(
            @PathVariable String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(ledgerService.history(userId, page, size));
    }

    @Operation(summary = "Get user achievements",
            description = "Milestones awarded to the user with their award time in epoch millis.")
    @GetMapping("/users/{userId}/achievements")
    public ResponseEntity<Map<String, Long>> getAchievements(@PathVariable String userId) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (Map.Entry<AchievementMilestone, Long> e : achievements.getAchievements(userId).entrySet()) {
            result.put(e.getKey().name(), e.getValue());
        }
        return ResponseEntity.ok(result);
    }
}
