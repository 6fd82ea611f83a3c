package com.chaincheck.error;

/**
 * Transient upstream failure: a ledger, archival index or settlement chain endpoint
 * was unreachable, timed out or answered with a transport-level error.
 *
 * <p>Callers may retry. Local state is never modified on this error.
 */
public class LedgerUnavailableException extends RuntimeException {
    public LedgerUnavailableException() {
    }

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerUnavailableException(Throwable cause) {
        super(cause);
    }

    public LedgerUnavailableException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
