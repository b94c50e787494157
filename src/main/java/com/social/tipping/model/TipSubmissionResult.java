package com.social.tipping.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Synchronous answer to a tip submission")
public class TipSubmissionResult {

    @Schema(description = "Whether the tip was queued for settlement", example = "true")
    private boolean accepted;

    @Schema(description = "Queue job id, set when accepted", example = "tip-user-123-user-456-1760000000000")
    private String jobId;

    @Schema(description = "Why the tip was rejected", example = "Daily tip limit reached: maximum 100 tips per 24 hours.")
    private String rejectionReason;

    @Schema(description = "Layer that rejected the tip", example = "RATE_LIMIT")
    private RejectionSource rejectionSource;

    @Schema(description = "Severity of an abuse rejection", example = "HIGH")
    private Severity severity;

    @Schema(description = "Seconds the client should wait before retrying", example = "3600")
    private Long retryAfterSeconds;

    @Schema(description = "Accepted but queued for operator review", example = "false")
    private boolean flaggedForReview;

    @Schema(description = "Why the tip was flagged")
    private String reviewReason;

    @Schema(description = "Moderation action applied to the message", example = "ALLOW")
    private ModerationAction moderationAction;

    public static TipSubmissionResult accepted(String jobId, AbuseAssessment assessment, ModerationVerdict verdict) {
        return TipSubmissionResult.builder()
                .accepted(true)
                .jobId(jobId)
                .flaggedForReview(assessment.isFlaggedForReview())
                .reviewReason(assessment.getReviewReason())
                .moderationAction(verdict.getAction())
                .build();
    }

    public static TipSubmissionResult rateLimited(RateLimitResult rejection) {
        return TipSubmissionResult.builder()
                .accepted(false)
                .rejectionSource(RejectionSource.RATE_LIMIT)
                .rejectionReason(rejection.getReason())
                .retryAfterSeconds(rejection.getRetryAfterSeconds())
                .build();
    }

    public static TipSubmissionResult abusive(AbuseAssessment assessment, Long retryAfterSeconds) {
        return TipSubmissionResult.builder()
                .accepted(false)
                .rejectionSource(RejectionSource.ABUSE)
                .rejectionReason(assessment.getReason())
                .severity(assessment.getSeverity())
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }

    public static TipSubmissionResult moderationBlocked(ModerationVerdict verdict) {
        return TipSubmissionResult.builder()
                .accepted(false)
                .rejectionSource(RejectionSource.MODERATION)
                .rejectionReason("Message rejected by content moderation: " + String.join(", ", verdict.getCategories()))
                .moderationAction(ModerationAction.BLOCK)
                .build();
    }
}
