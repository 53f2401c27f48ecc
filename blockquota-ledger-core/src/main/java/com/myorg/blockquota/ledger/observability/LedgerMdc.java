package com.myorg.blockquota.ledger.observability;

import org.slf4j.MDC;

public final class LedgerMdc {

    public static final String OPERATION = "ledgerOp";
    public static final String PROJECT_ID = "projectId";

    private LedgerMdc() {}

    public static void put(LedgerContext c) {
        if (c == null) return;
        if (c.operation() != null) MDC.put(OPERATION, c.operation());
        if (c.projectId() != null) MDC.put(PROJECT_ID, c.projectId());
    }

    /** What the calling thread has in the MDC right now, so it can be put back later. */
    public static LedgerContext current() {
        return new LedgerContext(MDC.get(OPERATION), MDC.get(PROJECT_ID));
    }

    /** Puts back a context taken with {@link #current()}; keys that were absent are removed. */
    public static void restore(LedgerContext previous) {
        clear();
        put(previous);
    }

    public static void clear() {
        MDC.remove(OPERATION);
        MDC.remove(PROJECT_ID);
    }
}
