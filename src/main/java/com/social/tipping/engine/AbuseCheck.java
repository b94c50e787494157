package com.social.tipping.engine;

import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.AbuseCheckType;
import com.social.tipping.model.TipAttempt;

/**
 * One independent abuse heuristic. Implementations record their own signals in the counter
 * store before reading them, and must be safe to run concurrently with the other checks.
 */
public interface AbuseCheck {

    AbuseCheckType getCheckType();

    AbuseCheckResult evaluate(TipAttempt attempt);

    /**
     * Delete the sender-scoped signals this check keeps. No-op for stateless checks.
     */
    default void clearSignals(String userId) {
    }
}
