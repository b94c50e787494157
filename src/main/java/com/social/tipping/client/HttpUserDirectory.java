package com.social.tipping.client;

import com.social.tipping.model.UserProfile;
import com.social.tipping.model.VerificationTier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class HttpUserDirectory implements UserDirectory {

    private final RestTemplate restTemplate;

    public HttpUserDirectory(@Qualifier("userDirectoryRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<UserProfile> findProfile(String userId) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> profile = restTemplate.getForObject(
                    "/api/v1/users/{userId}/profile", Map.class, userId);
            if (profile == null) {
                return Optional.empty();
            }
            return Optional.of(UserProfile.builder()
                    .userId(userId)
                    .verificationTier(tier(profile.get("verificationTier")))
                    .walletAddress((String) profile.get("walletAddress"))
                    .build());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> findNotificationNumber(String userId) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> contact = restTemplate.getForObject(
                    "/api/v1/users/{userId}/contact", Map.class, userId);
            if (contact == null || !Boolean.TRUE.equals(contact.get("tipNotifications"))) {
                return Optional.empty();
            }
            return Optional.ofNullable((String) contact.get("phoneNumber"));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    // Unknown or missing levels get the lowest limits.
    static VerificationTier tier(Object raw) {
        if (raw == null) {
            return VerificationTier.UNVERIFIED;
        }
        try {
            return VerificationTier.valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return VerificationTier.UNVERIFIED;
        }
    }
}
