package com.social.tipping.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A queued tip awaiting or past settlement")
public class TipJob {

    @Schema(description = "tip-{sender}-{recipient}-{epochMs}", example = "tip-user-123-user-456-1760000000000")
    private String jobId;

    private String senderId;
    private String recipientId;

    @Schema(description = "Amount in the token's smallest unit", example = "1500000")
    private long amount;

    @Schema(description = "Reference to the sealed message, null when the tip carries none")
    private String contentReference;

    private ModerationVerdict moderationVerdict;

    @Schema(description = "Enqueue time in epoch millis")
    private long createdAt;

    private int attemptCount;
    private JobStatus status;

    @Schema(description = "Earliest time the job may run, epoch millis")
    private long availableAt;

    @Schema(description = "Lock expiry of an ACTIVE job, epoch millis")
    private long lockedUntil;

    private String lastError;

    @Schema(description = "Settlement handle, set once settled")
    private String transactionHandle;

    private boolean flaggedForReview;
    private long completedAt;

    // Record generation this copy was read or claimed at; guards later writes.
    @JsonIgnore
    @Schema(hidden = true)
    private int generation;

    public static String buildJobId(String senderId, String recipientId, long enqueuedAtEpochMs) {
        return "tip-" + senderId + "-" + recipientId + "-" + enqueuedAtEpochMs;
    }
}
