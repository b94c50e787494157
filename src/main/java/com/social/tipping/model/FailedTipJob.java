package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dead-letter record of a job that will not be retried automatically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedTipJob {
    private String jobId;
    private TipJob job;
    private String error;
    private FailureKind failureKind;
    private int attempts;
    private long failedAt;
}
