package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Every score and counter increment caused by one settled tip.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TipTally {
    private String jobId;
    private String senderId;
    private String recipientId;
    private long amount;
    private String weekKey;
}
