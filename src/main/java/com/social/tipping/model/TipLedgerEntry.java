package com.social.tipping.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Relational copy of every settled tip. Replays of the same job are rejected by the unique job id.
 */
@Entity
@Table(name = "tip_ledger", indexes = {
        @Index(name = "idx_tip_ledger_sender", columnList = "sender_id"),
        @Index(name = "idx_tip_ledger_recipient", columnList = "recipient_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TipLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, unique = true, length = 200)
    private String jobId;

    @Column(name = "sender_id", nullable = false, length = 64)
    private String senderId;

    @Column(name = "recipient_id", nullable = false, length = 64)
    private String recipientId;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "period_key", nullable = false, length = 16)
    private String periodKey;

    @Column(name = "transaction_handle", length = 200)
    private String transactionHandle;

    @Column(name = "settled_at", nullable = false)
    private Instant settledAt;
}
