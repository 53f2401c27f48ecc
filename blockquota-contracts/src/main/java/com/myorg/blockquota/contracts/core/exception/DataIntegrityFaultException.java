package com.myorg.blockquota.contracts.core.exception;

/**
 * The ledger found itself in a state it can never produce on its own, e.g. an unresolved
 * reservation whose usage row is gone.
 */
public class DataIntegrityFaultException extends BlockQuotaNonRetryableException {
    public DataIntegrityFaultException(String message) {
        super("DATA_INTEGRITY", message);
    }
}
