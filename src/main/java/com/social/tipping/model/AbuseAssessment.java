package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Combined verdict of every abuse check run for one tip attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbuseAssessment {
    private boolean allowed;
    private String reason;              // from the most severe rejection
    private Severity severity;
    private AbuseCheckType checkType;   // check that rejected, null when allowed
    private boolean flaggedForReview;
    private String reviewReason;
    private List<AbuseCheckResult> results;
}
