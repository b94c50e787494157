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
 * Hourly send count per wallet, independent of which user id drives it.
 */
@Component
public class WalletVelocityCheck implements AbuseCheck {

    private final CounterStore counterStore;
    private final AbuseDetectionConfig config;

    public WalletVelocityCheck(CounterStore counterStore, AbuseDetectionConfig config) {
        this.counterStore = counterStore;
        this.config = config;
    }

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.WALLET_VELOCITY;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        if (attempt.getSenderAddress() == null) {
            return AbuseCheckResult.pass(getCheckType());
        }
        AbuseDetectionConfig.WalletVelocity wallet = config.getWalletVelocity();
        long count = counterStore.increment(AerospikeConfig.SET_ABUSE_SIGNALS,
                "wallet_velocity:" + attempt.getSenderAddress().toLowerCase(), 1, wallet.getTtlSeconds());
        if (count > wallet.getMaxPerHour()) {
            return AbuseCheckResult.reject(getCheckType(), Severity.HIGH,
                    "Wallet activity limit exceeded.",
                    Map.of("hourlyCount", count));
        }
        return AbuseCheckResult.pass(getCheckType());
    }
}
