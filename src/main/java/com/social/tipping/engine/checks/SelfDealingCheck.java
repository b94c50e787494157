package com.social.tipping.engine.checks;

import com.social.tipping.engine.AbuseCheck;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.AbuseCheckType;
import com.social.tipping.model.Severity;
import com.social.tipping.model.TipAttempt;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Rejects tips to oneself: the same user on both sides, or two accounts sharing one wallet address.
 */
@Component
public class SelfDealingCheck implements AbuseCheck {

    @Override
    public AbuseCheckType getCheckType() {
        return AbuseCheckType.SELF_DEALING;
    }

    @Override
    public AbuseCheckResult evaluate(TipAttempt attempt) {
        if (attempt.getSenderId() != null && attempt.getSenderId().equals(attempt.getRecipientId())) {
            return AbuseCheckResult.reject(getCheckType(), Severity.CRITICAL,
                    "Cannot tip yourself.", Map.of("userId", attempt.getSenderId()));
        }
        String sender = attempt.getSenderAddress();
        String recipient = attempt.getRecipientAddress();
        if (sender != null && sender.equalsIgnoreCase(recipient)) {
            return AbuseCheckResult.reject(getCheckType(), Severity.CRITICAL,
                    "Cannot tip yourself.", Map.of("address", sender.toLowerCase()));
        }
        return AbuseCheckResult.pass(getCheckType());
    }
}
