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
 * Scripted senders tend to repeat the exact same amount, often a round one.
 */
@Component
public class PatternRepetitionCheck implements AbuseCheck {

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;

    public PatternRepetitionCheck(CounterStore counterStore, AbuseDetectionConfig config) {
        this.counterStore = counterStore;
        this.config = config;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.PATTERN_REPETITION;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        AbuseDetectionConfig.Pattern pattern = config.getPattern();
        String sender = attempt.getSenderId();
        long amount = attempt.getAmount();

        long identical = counterStore.increment(AerospikeConfig.SET_ABUSE_SIGNALS,
                "pattern_amount:" + sender + ":" + amount, 1, pattern.getTtlSeconds());
        if (identical > pattern.getMaxIdenticalPerHour()) {
            return AbuseCheckResult.reject(getCheckType(), Severity.MEDIUM,
                    "Repetitive tipping pattern detected.",
                    Map.of("identicalAmountCount", identical));
        }

        if (pattern.getRoundAmounts().contains(amount)) {
            long round = counterStore.increment(AerospikeConfig.SET_ABUSE_SIGNALS,
                    "pattern_round:" + sender + ":" + amount, 1, pattern.getTtlSeconds());
            if (round > pattern.getMaxRoundPerHour()) {
                return AbuseCheckResult.reject(getCheckType(), Severity.LOW,
                        "Unusual tipping pattern detected.",
                        Map.of("roundAmountCount", round));
            }
        }
        return AbuseCheckResult.pass(getCheckType());
    }
}
