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
@Schema(description = "Tipping totals and ranks of one user")
public class UserStatSnapshot {
    private String subjectId;
    private long tipsSent;
    private long tipsReceived;
    private long amountSent;
    private long amountReceived;

    @Schema(description = "Tips sent in the current ISO week")
    private long weeklyTips;

    @Schema(description = "Amount sent in the current ISO week")
    private long weeklyAmount;

    @Schema(description = "1-based all-time sender rank, null when unranked")
    private Long globalRank;

    @Schema(description = "1-based sender rank for the current week, null when unranked")
    private Long weeklyRank;

    private String periodKey;
}
