package com.myorg.blockquota.ledger.update;

import com.myorg.blockquota.ledger.LedgerTx;

import java.util.Map;
import java.util.Optional;

public interface ConditionalUpdater {

    /**
     * Apply the update inside the caller's transaction.
     *
     * @return true if at least one row changed; zero matches is not an error
     * @throws com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException when the update
     *         touches more than one entity type or names unknown columns
     */
    boolean conditionalUpdate(LedgerTx tx, ConditionalUpdate update);

    /** Same as {@link #conditionalUpdate(LedgerTx, ConditionalUpdate)} in its own transaction, retried on deadlock. */
    boolean conditionalUpdate(ConditionalUpdate update);

    /** Read one row by primary key as a column map. */
    Optional<Map<String, Object>> get(LedgerTx tx, EntityType entity, Object id);
}
