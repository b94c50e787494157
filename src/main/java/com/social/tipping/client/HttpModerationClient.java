package com.social.tipping.client;

import com.social.tipping.model.ModerationVerdict;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class HttpModerationClient implements ModerationClient {

    private final RestTemplate restTemplate;

    public HttpModerationClient(@Qualifier("moderationRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ModerationVerdict moderate(String message, String senderId, String recipientId) {
        ModerationVerdict verdict = restTemplate.postForObject("/api/v1/moderate",
                Map.of("text", message, "senderId", senderId, "recipientId", recipientId),
                ModerationVerdict.class);
        if (verdict == null || verdict.getAction() == null) {
            throw new IllegalStateException("Moderation service returned an empty verdict");
        }
        return verdict;
    }
}
