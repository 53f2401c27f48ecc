package com.myorg.blockquota.ledger;

import java.time.Instant;

/**
 * Explicit handle of one store transaction. Every ledger step that reads or writes the store takes it
 * as a parameter; nothing looks it up from ambient state.
 */
public interface LedgerTx {

    /** Wall clock time captured when the transaction began. */
    Instant startedAt();

    /** Mark the transaction so that it rolls back instead of committing when its callback returns. */
    void setRollbackOnly();
}
