package com.chaincheck.error;

/**
 * The escrow contract (or the chain) rejected a settlement call before it was mined.
 * The message carries the revert reason.
 */
public class SettlementRevertedException extends RuntimeException {
    public SettlementRevertedException() {
    }

    public SettlementRevertedException(String message) {
        super(message);
    }

    public SettlementRevertedException(String message, Throwable cause) {
        super(message, cause);
    }

    public SettlementRevertedException(Throwable cause) {
        super(cause);
    }

    public SettlementRevertedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
