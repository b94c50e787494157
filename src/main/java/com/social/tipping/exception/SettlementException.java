package com.social.tipping.exception;

import com.social.tipping.model.FailureKind;

/**
 * Settlement failure whose retryability the settlement client already knows.
 */
public class SettlementException extends TipPipelineException {

    private final FailureKind kind;

    public SettlementException(String message, FailureKind kind) {
        super(message);
        this.kind = kind;
    }

    public SettlementException(String message, FailureKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
