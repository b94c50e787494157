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

import java.util.Map;

/**
 * Detects farming: many tiny tips between the same pair, typically to game tip-count rankings.
 */
@Component
public class FarmingCheck implements AbuseCheck {

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;

    public FarmingCheck(CounterStore counterStore, AbuseDetectionConfig config) {
        this.counterStore = counterStore;
        this.config = config;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.FARMING;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        AbuseDetectionConfig.Farming farming = config.getFarming();
        if (attempt.getAmount() >= farming.getAmountThreshold()) {
            return AbuseCheckResult.pass(getCheckType());
        }

        String pair = attempt.getSenderId() + ":" + attempt.getRecipientId();
        long count = counterStore.increment(AerospikeConfig.SET_ABUSE_SIGNALS,
                "farming:" + pair, 1, farming.getTtlSeconds());
        if (count > farming.getMaxPerDay()) {
            return AbuseCheckResult.reject(getCheckType(), Severity.MEDIUM,
                    "Too many small tips to the same user today.",
                    Map.of("pairCount", count));
        }

        long cumulative = counterStore.increment(AerospikeConfig.SET_ABUSE_SIGNALS,
                "farming_amount:" + pair, attempt.getAmount(), farming.getTtlSeconds());
        if (count > farming.getSuspiciousCount()
                && cumulative < attempt.getAmount() * farming.getCumulativeMultiplier()) {
            return AbuseCheckResult.reject(getCheckType(), Severity.MEDIUM,
                    "Suspicious tipping pattern detected.",
                    Map.of("pairCount", count, "cumulativeAmount", cumulative));
        }
        return AbuseCheckResult.pass(getCheckType());
    }
}
