package com.social.tipping.client;

/**
 * Moves value from sender to recipient on the settlement backend.
 *
 * <p>Implementations throw {@link com.social.tipping.exception.SettlementException} with a
 * {@link com.social.tipping.model.FailureKind} when they know whether a retry can help. The same
 * job may be submitted more than once, so the backend is expected to deduplicate on the job id.
 */
public interface SettlementClient {

    /**
     * @return the backend's handle for the settled transfer
     */
    String settle(String jobId, String senderId, String recipientId, long amount, String contentReference);
}
