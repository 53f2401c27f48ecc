package com.myorg.blockquota.contracts.core.exception;

// Raised for malformed conditional updates: multi-table writes, unknown columns, bad predicates.
public class ProgrammingErrorException extends BlockQuotaNonRetryableException {
    public ProgrammingErrorException(String message) {
        super("PROGRAMMING_ERROR", message);
    }
}
