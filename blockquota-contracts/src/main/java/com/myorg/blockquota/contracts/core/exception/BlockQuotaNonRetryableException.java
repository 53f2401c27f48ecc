package com.myorg.blockquota.contracts.core.exception;

/**
 * Failure that must never be retried: a caller defect, a corrupted ledger or a store that kept failing
 * after every allowed retry. The {@link #getReason()} code is stable and safe to log or alert on.
 */
public class BlockQuotaNonRetryableException extends RuntimeException {

    private final String reason;

    public BlockQuotaNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public BlockQuotaNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public BlockQuotaNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
