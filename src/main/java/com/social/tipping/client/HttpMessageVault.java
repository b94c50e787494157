package com.social.tipping.client;

import com.social.tipping.exception.TipPipelineException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class HttpMessageVault implements MessageVault {

    private final RestTemplate restTemplate;

    public HttpMessageVault(@Qualifier("messageVaultRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String seal(String senderId, String recipientId, String message) {
        @SuppressWarnings("unchecked")
        Map<String, Object> response = restTemplate.postForObject("/api/v1/messages",
                Map.of("senderId", senderId, "recipientId", recipientId, "message", message), Map.class);
        Object reference = response != null ? response.get("contentReference") : null;
        if (reference == null) {
            throw new TipPipelineException("Message vault returned no content reference");
        }
        return reference.toString();
    }
}
