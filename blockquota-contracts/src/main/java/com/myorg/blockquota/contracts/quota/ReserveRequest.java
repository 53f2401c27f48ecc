package com.myorg.blockquota.contracts.quota;

import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of a reserve call. {@code expire}, {@code untilRefresh} and {@code maxAge} fall back to the
 * ledger configuration when left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReserveRequest {
    private String projectId;

    /** Resource definitions, keyed by resource name; must cover every key of {@link #deltas}. */
    @Builder.Default
    private Map<String, QuotaResource> resources = new LinkedHashMap<>();

    /** Effective hard limits, keyed by resource name; negative = unlimited. */
    @Builder.Default
    private Map<String, Integer> quotas = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> deltas = new LinkedHashMap<>();

    private Instant expire;
    private Integer untilRefresh;
    private Duration maxAge;
}
