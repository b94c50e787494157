package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TipReviewItem {
    private String jobId;
    private String senderId;
    private String recipientId;
    private long amount;
    private String reason;
    private long enqueuedAt;
    private ReviewStatus status;
    private String reviewedBy;          // operator id, empty until resolved
    private long reviewedAt;            // 0 until resolved
}
