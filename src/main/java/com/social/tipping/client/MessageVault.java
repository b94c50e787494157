package com.social.tipping.client;

/**
 * Encrypts a tip message and stores it outside the pipeline.
 */
public interface MessageVault {

    /**
     * @return opaque reference to the stored message
     */
    String seal(String senderId, String recipientId, String message);
}
