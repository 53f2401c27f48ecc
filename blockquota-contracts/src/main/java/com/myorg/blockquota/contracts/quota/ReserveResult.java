package com.myorg.blockquota.contracts.quota;

import java.util.List;

/**
 * Outcome of a reserve attempt. Over quota is an expected outcome callers branch on, not an error.
 */
public record ReserveResult(Decision decision, List<String> reservations, OverQuotaDetail overQuota) {

    public enum Decision {
        /** Every delta was admitted; {@link #reservations()} holds one uuid per delta. */
        RESERVED,
        /** At least one resource would exceed its hard limit; nothing was reserved. */
        OVER_QUOTA
    }

    public static ReserveResult reserved(List<String> reservations) {
        return new ReserveResult(Decision.RESERVED, List.copyOf(reservations), null);
    }

    public static ReserveResult overQuota(OverQuotaDetail detail) {
        return new ReserveResult(Decision.OVER_QUOTA, List.of(), detail);
    }

    public boolean isReserved() {
        return decision == Decision.RESERVED;
    }
}
