package com.social.tipping.engine.checks;

import com.social.tipping.config.AbuseDetectionConfig;
import com.social.tipping.config.AerospikeConfig;
import com.social.tipping.engine.AbuseCheck;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.AbuseCheckType;
import com.social.tipping.model.Severity;
import com.social.tipping.model.TipAttempt;
import com.social.tipping.repository.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags, but never blocks, tips far above the sender's usual size.
 *
 * <p>The usual size is an exponential moving average of the sender's amounts, updated after
 * every assessment.
 */
@Component
public class AmountAnomalyCheck implements AbuseCheck {

    private static final Logger log = LoggerFactory.getLogger(AmountAnomalyCheck.class);

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;

    public AmountAnomalyCheck(CounterStore counterStore, AbuseDetectionConfig config) {
        this.counterStore = counterStore;
        this.config = config;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.AMOUNT_ANOMALY;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        AbuseDetectionConfig.Anomaly anomaly = config.getAnomaly();
        String key = key(attempt.getSenderId());
        long amount = attempt.getAmount();

        Double average = counterStore.getDouble(AerospikeConfig.SET_ABUSE_SIGNALS, key);
        double updated = average == null
                ? amount
                : average * anomaly.getEmaRetain() + amount * (1 - anomaly.getEmaRetain());
        counterStore.putDouble(AerospikeConfig.SET_ABUSE_SIGNALS, key, updated, anomaly.getTtlSeconds());

        if (average != null && amount > average * anomaly.getMultiplier() && amount > anomaly.getMinAmount()) {
            log.info("Unusual tip amount from sender={}: amount={} average={}",
                    attempt.getSenderId(), amount, Math.round(average));
            return AbuseCheckResult.flag(getCheckType(), Severity.MEDIUM,
                    String.format("Tip amount %d is more than %.0fx the sender's average of %d",
                            amount, anomaly.getMultiplier(), Math.round(average)),
                    Map.of("average", average, "amount", amount));
        }
        return AbuseCheckResult.pass(getCheckType());
    }

    @Override
    public void clearSignals(String userId) {
        counterStore.delete(AerospikeConfig.SET_ABUSE_SIGNALS, key(userId));
    }

    private static String key(String senderId) {
        return "avg_tip:" + senderId;
    }
}
