package com.myorg.blockquota.contracts.core.exception;

public class StoreRetryExhaustedException extends BlockQuotaNonRetryableException {

    private final int attempts;

    public StoreRetryExhaustedException(String operation, int attempts, Throwable cause) {
        super("RETRY_EXHAUSTED", "Store operation " + operation + " failed after attempts=" + attempts, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
