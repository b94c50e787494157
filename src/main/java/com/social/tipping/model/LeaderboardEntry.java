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
@Schema(description = "One ranked row of a leaderboard")
public class LeaderboardEntry {

    @Schema(description = "1-based rank, computed on read", example = "1")
    private long rank;

    @Schema(description = "Ranked user", example = "user-123")
    private String subjectId;

    @Schema(description = "Total amount in the token's smallest unit", example = "250000000")
    private long score;

    @Schema(description = "Period bucket: 'all' or an ISO week such as 2026-W42", example = "2026-W42")
    private String periodKey;
}
