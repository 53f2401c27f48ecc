package com.myorg.blockquota.ledger.sync;

import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.ledger.LedgerTx;

/**
 * Recomputes the true usage of one resource from the authoritative domain tables.
 * Must be free of side effects; the ledger only trusts the result at the instant it is called.
 */
@FunctionalInterface
public interface ResourceSyncFunction {

    int sync(LedgerTx tx, String projectId, QuotaResource resource);
}
