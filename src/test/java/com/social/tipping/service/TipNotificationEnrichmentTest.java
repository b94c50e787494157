package com.social.tipping.service;

import com.social.tipping.client.UserDirectory;
import com.social.tipping.config.CircuitBreakerProperties;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.config.TwilioNotificationConfig;
import com.social.tipping.model.SettledTip;
import com.social.tipping.resilience.CircuitBreakers;
import com.social.tipping.testutil.InMemoryCounterStore;
import com.social.tipping.testutil.MutableClock;
import com.social.tipping.testutil.TestDataFactory;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TipNotificationEnrichmentTest {

    @Mock private UserDirectory userDirectory;
    @Mock private MetricsConfig metricsConfig;

    private TwilioNotificationConfig config;
    private TipNotificationEnrichment enrichment;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-10-14T12:00:00Z");
        config = new TwilioNotificationConfig();
        RateLimitService rateLimitService = new RateLimitService(new InMemoryCounterStore(clock),
                TestDataFactory.defaultRateLimitConfig(), metricsConfig, clock);
        CircuitBreakers breakers = new CircuitBreakers(CircuitBreakerRegistry.ofDefaults(),
                new CircuitBreakerProperties()::optionsFor, clock);
        enrichment = new TipNotificationEnrichment(config, userDirectory, rateLimitService, breakers, metricsConfig);
    }

    @Test
    void disabled_doesNothing() {
        enrichment.onTipSettled(TestDataFactory.createSettledTip("tip-a-b-1", "a", "b", 1L));

        verifyNoInteractions(userDirectory, metricsConfig);
    }

    @Test
    void recipientWithoutNumber_isSkipped() {
        config.setEnabled(true);
        when(userDirectory.findNotificationNumber("b")).thenReturn(Optional.empty());

        enrichment.onTipSettled(TestDataFactory.createSettledTip("tip-a-b-1", "a", "b", 1L));

        verify(metricsConfig, never()).recordNotification(anyString(), anyString());
    }

    @Test
    void recipientNotificationsAreRateLimited() {
        config.setEnabled(true);
        when(userDirectory.findNotificationNumber("b")).thenReturn(Optional.empty());

        for (int i = 0; i < 21; i++) {
            enrichment.onTipSettled(TestDataFactory.createSettledTip("tip-a-b-" + i, "a", "b", 1L));
        }

        verify(userDirectory, times(20)).findNotificationNumber("b");
        verify(metricsConfig).recordNotification("sms", "rate_limited");
    }

    @Test
    void messageBody_showsWholeTokens() {
        SettledTip tip = TestDataFactory.createSettledTip("tip-a-b-1", "alice", "bob", 2_500_000L);

        assertThat(enrichment.buildMessageBody(tip))
                .contains("From: alice")
                .contains("Amount: 2.5 tokens")
                .contains("Ref: tx-tip-a-b-1");
    }
}
