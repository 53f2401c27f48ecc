package com.myorg.blockquota.jdbc.retry;

public enum StoreErrorKind {
    /** Deadlock victim, lock wait timeout or serialization failure; the transaction was rolled back. */
    DEADLOCK("DEADLOCK"),
    /** Unique constraint hit, e.g. two callers creating the same usage row. */
    DUPLICATE_KEY("DUPLICATE_KEY"),
    /** Everything else; never retried. */
    NON_TRANSIENT("NON_TRANSIENT");

    private final String code;

    StoreErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
