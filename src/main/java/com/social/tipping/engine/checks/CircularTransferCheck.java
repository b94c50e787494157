package com.social.tipping.engine.checks;

import com.social.tipping.config.AbuseDetectionConfig;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.engine.AbuseCheck;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.AbuseCheckType;
import com.social.tipping.model.Severity;
import com.social.tipping.model.TipAttempt;
import com.social.tipping.repository.CounterStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Rejects A -> B when B -> A was seen within the circular window. Every direction checked
 * records its own timestamp, so the first leg of a round trip is remembered.
 */
@Component
public class CircularTransferCheck implements AbuseCheck {

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;
    private final Clock clock;

    public CircularTransferCheck(CounterStore counterStore, AbuseDetectionConfig config, Clock clock) {
        this.counterStore = counterStore;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.CIRCULAR_TRANSFER;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        long now = clock.millis();
        long windowMs = config.getCircular().getWindowMs();

        Long reverseAt = counterStore.getLong(AerospikeConfig.SET_ABUSE_SIGNALS,
                key(attempt.getRecipientId(), attempt.getSenderId()));
        counterStore.putLong(AerospikeConfig.SET_ABUSE_SIGNALS,
                key(attempt.getSenderId(), attempt.getRecipientId()), now, (int) (windowMs / 1000));

        if (reverseAt != null && now - reverseAt < windowMs) {
            return AbuseCheckResult.reject(getCheckType(), Severity.HIGH,
                    "Circular tipping detected. Please wait before tipping this user back.",
                    Map.of("reverseTipAt", reverseAt));
        }
        return AbuseCheckResult.pass(getCheckType());
    }

    static String key(String from, String to) {
        return "circular:" + from + ":" + to;
    }
}
