package com.social.tipping.service;

import com.social.tipping.client.UserDirectory;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.config.TwilioNotificationConfig;
import com.social.tipping.model.RateLimitResult;
import com.social.tipping.model.RateLimitScope;
import com.social.tipping.model.SettledTip;
import com.social.tipping.model.VerificationTier;
import com.social.tipping.resilience.CircuitBreaker;
import com.social.tipping.resilience.CircuitBreakers;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Tells the recipient they were tipped, by SMS or WhatsApp through Twilio. Limited per
 * recipient so a burst of tips does not turn into a burst of messages.
 */
@Component
public class TipNotificationEnrichment implements TipEnrichment {

    private static final Logger log = LoggerFactory.getLogger(TipNotificationEnrichment.class);
    private static final int TOKEN_DECIMALS = 6;

    private final TwilioNotificationConfig config;
    private final UserDirectory userDirectory;
    private final RateLimitService rateLimitService;
    private final CircuitBreaker notificationBreaker;
    private final MetricsConfig metricsConfig;

    public TipNotificationEnrichment(TwilioNotificationConfig config,
                                     UserDirectory userDirectory,
                                     RateLimitService rateLimitService,
                                     CircuitBreakers breakers,
                                     MetricsConfig metricsConfig) {
        this.config = config;
        this.userDirectory = userDirectory;
        this.rateLimitService = rateLimitService;
        this.notificationBreaker = breakers.get("notification");
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio tip notifications initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio tip notifications are DISABLED.");
        }
    }

    @Override
    public String getName() {
        return "notification";
    }

    @Override
    @Observed(name = "notification.send", contextualName = "send-tip-notification")
    public void onTipSettled(SettledTip tip) {
        if (!config.isEnabled()) {
            return;
        }

        RateLimitResult limit = rateLimitService.checkLimit(RateLimitScope.NOTIFY, tip.getRecipientId(),
                rateLimitService.limitFor(RateLimitScope.NOTIFY), VerificationTier.UNVERIFIED);
        if (!limit.isAllowed()) {
            metricsConfig.recordNotification(config.getChannel(), "rate_limited");
            log.debug("Notification for recipient={} suppressed: {}", tip.getRecipientId(), limit.getReason());
            return;
        }

        Optional<String> number = userDirectory.findNotificationNumber(tip.getRecipientId());
        if (number.isEmpty()) {
            log.debug("Recipient {} has no notification number, skipping", tip.getRecipientId());
            return;
        }

        String body = buildMessageBody(tip);
        Message message = notificationBreaker.execute(() -> Message.creator(
                new PhoneNumber(resolveNumber(number.get())),
                new PhoneNumber(resolveNumber(config.getFromNumber())),
                body
        ).create());

        metricsConfig.recordNotification(config.getChannel(), "success");
        log.info("Tip notification sent for job={}, sid={}", tip.getJobId(), message.getSid());
    }

    String buildMessageBody(SettledTip tip) {
        BigDecimal tokens = BigDecimal.valueOf(tip.getAmount(), TOKEN_DECIMALS).stripTrailingZeros();
        return String.format(
                "You received a tip!\n" +
                "From: %s\n" +
                "Amount: %s tokens\n" +
                "Ref: %s",
                tip.getSenderId(),
                tokens.toPlainString(),
                tip.getTransactionHandle());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
