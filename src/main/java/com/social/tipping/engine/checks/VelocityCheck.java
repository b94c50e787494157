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
import java.util.List;
import java.util.Map;

/**
 * Burst detection on a capped list of the sender's most recent tip timestamps.
 */
@Component
public class VelocityCheck implements AbuseCheck {

    public static final String RETRY_AFTER_SECONDS = "retryAfterSeconds";

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;
    private final Clock clock;

    public VelocityCheck(CounterStore counterStore, AbuseDetectionConfig config, Clock clock) {
        this.counterStore = counterStore;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.VELOCITY;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        AbuseDetectionConfig.Velocity velocity = config.getVelocity();
        long now = clock.millis();
        String key = key(attempt.getSenderId());

        List<Long> recent = counterStore.getRecent(AerospikeConfig.SET_ABUSE_SIGNALS, key);
        long inWindow = 0;
        long oldestInWindow = now;
        for (Long ts : recent) {
            if (now - ts < velocity.getWindowMs()) {
                inWindow++;
                oldestInWindow = Math.min(oldestInWindow, ts);
            }
        }

        if (inWindow >= velocity.getMaxTips()) {
            long waitSeconds = Math.max(1L, (velocity.getWindowMs() - (now - oldestInWindow) + 999) / 1000);
            return AbuseCheckResult.reject(getCheckType(), Severity.HIGH,
                    "Too many tips in a short period. Please wait " + waitSeconds + " seconds.",
                    Map.of("recentTips", inWindow, RETRY_AFTER_SECONDS, waitSeconds));
        }

        counterStore.pushRecent(AerospikeConfig.SET_ABUSE_SIGNALS, key, now, velocity.getMaxTips(),
                (int) (velocity.getWindowMs() / 1000));
        return AbuseCheckResult.pass(getCheckType());
    }

    @Override
    public void clearSignals(String userId) {
        counterStore.delete(AerospikeConfig.SET_ABUSE_SIGNALS, key(userId));
    }

    private static String key(String senderId) {
        return "velocity:" + senderId;
    }
}
