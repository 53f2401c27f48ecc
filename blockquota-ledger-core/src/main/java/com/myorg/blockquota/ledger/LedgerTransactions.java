package com.myorg.blockquota.ledger;

import java.util.function.Function;

/**
 * Opens a transaction, runs the callback with its handle, then commits (or rolls back when the callback
 * throws or marks it rollback-only). The transaction is always a new one, independent of any transaction
 * the calling thread already has open.
 */
public interface LedgerTransactions {

    <T> T inTransaction(Function<LedgerTx, T> work);
}
