package com.social.tipping.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The facts about a tip the abuse checks look at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TipAttempt {
    private String senderId;
    private String recipientId;
    private long amount;
    private String senderAddress;
    private String recipientAddress;
}
