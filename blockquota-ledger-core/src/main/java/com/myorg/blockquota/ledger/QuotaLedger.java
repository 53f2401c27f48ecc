package com.myorg.blockquota.ledger;

import com.myorg.blockquota.contracts.quota.Quota;
import com.myorg.blockquota.contracts.quota.QuotaUsage;
import com.myorg.blockquota.contracts.quota.ReserveRequest;
import com.myorg.blockquota.contracts.quota.ReserveResult;
import com.myorg.blockquota.contracts.quota.UsageSnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Usage and reservation ledger of per project quota limited resources.
 *
 * <p>Every method is safe to call concurrently from any number of threads and processes sharing the
 * same store. Coordination happens only through row locks: usage rows are always locked before
 * reservation rows, each kind in ascending id order.
 */
public interface QuotaLedger {

    /**
     * Claim {@code deltas} against the project's usage rows, creating missing rows from the resource
     * sync functions and healing stale ones first.
     *
     * @return {@link ReserveResult.Decision#RESERVED} with one reservation uuid per delta, or
     *         {@link ReserveResult.Decision#OVER_QUOTA}; refreshed usage is kept in both cases
     */
    ReserveResult reserve(ReserveRequest request);

    /**
     * Apply the reservations to {@code in_use} and delete them. Unknown uuids are ignored.
     * A negative delta never drives {@code in_use} below zero.
     */
    void commit(Collection<String> reservationUuids, String projectId);

    /** Release the reservations without touching {@code in_use}. Unknown uuids are ignored. */
    void rollback(Collection<String> reservationUuids, String projectId);

    /**
     * Roll back every reservation whose expiry is before {@code now}.
     *
     * @return number of reservations this call removed
     */
    int expire(Instant now);

    Map<String, UsageSnapshot> getUsage(String projectId);

    Optional<QuotaUsage> getUsage(String projectId, String resource);

    Optional<Quota> getQuota(String projectId, String resource);
}
