package com.social.tipping.service;

import com.social.tipping.exception.InvalidTipException;
import com.social.tipping.exception.SettlementException;
import com.social.tipping.model.FailureKind;
import com.social.tipping.resilience.CircuitBreakerOpenException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed job is worth retrying.
 *
 * <p>An explicit kind carried by the exception wins. Otherwise the messages along the cause chain
 * are matched, permanent patterns first. Anything unrecognised is treated as transient.
 */
@Component
public class FailureClassifier {

    private static final List<String> PERMANENT_PATTERNS = List.of(
            "validation", "invalid", "unauthorized", "forbidden", "not found",
            "insufficient funds", "insufficient balance");

    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "network", "timeout", "timed out", "etimedout", "connection", "econnrefused",
            "econnreset", "rate limit", "too many requests", "unavailable", "503");

    public FailureKind classify(Throwable error) {
        Throwable root = unwrap(error);

        if (root instanceof CircuitBreakerOpenException) {
            return FailureKind.TRANSIENT;
        }
        if (root instanceof SettlementException settlement && settlement.getKind() != null) {
            return settlement.getKind();
        }
        if (root instanceof InvalidTipException) {
            return FailureKind.PERMANENT;
        }
        if (root instanceof IOException || root instanceof TimeoutException) {
            return FailureKind.TRANSIENT;
        }

        String messages = collectMessages(root);
        if (PERMANENT_PATTERNS.stream().anyMatch(messages::contains)) {
            return FailureKind.PERMANENT;
        }
        if (TRANSIENT_PATTERNS.stream().anyMatch(messages::contains)) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.TRANSIENT;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String collectMessages(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current.getMessage() != null) {
                sb.append(current.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
            current = current.getCause();
        }
        return sb.toString();
    }
}
