package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event handed to enrichments once a tip is settled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettledTip {
    private String jobId;
    private String senderId;
    private String recipientId;
    private long amount;
    private String contentReference;
    private String transactionHandle;
    private long settledAt;
}
