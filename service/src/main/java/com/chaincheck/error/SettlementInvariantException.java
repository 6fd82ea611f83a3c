package com.chaincheck.error;

/**
 * A settlement request contradicts the recorded payment state, e.g. a refund for a
 * delivery that was never escrowed or a release after a refund.
 */
public class SettlementInvariantException extends IllegalStateException {
    public SettlementInvariantException() {
    }

    public SettlementInvariantException(String message) {
        super(message);
    }

    public SettlementInvariantException(String message, Throwable cause) {
        super(message, cause);
    }

    public SettlementInvariantException(Throwable cause) {
        super(cause);
    }
}
