package com.social.tipping.client;

import com.social.tipping.model.ModerationVerdict;

public interface ModerationClient {

    ModerationVerdict moderate(String message, String senderId, String recipientId);
}
