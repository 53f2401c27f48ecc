package com.myorg.blockquota.jdbc;

import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.LedgerTx;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.function.Function;

/**
 * Every call runs in a transaction of its own. A transaction the caller already has open is suspended,
 * never joined.
 */
public class JdbcLedgerTransactions implements LedgerTransactions {

    private final TransactionTemplate tx;
    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcLedgerTransactions(PlatformTransactionManager txManager, JdbcTemplate jdbc, Clock clock) {
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public <T> T inTransaction(Function<LedgerTx, T> work) {
        return tx.execute(st -> work.apply(
                new JdbcLedgerTx(jdbc, st, clock.instant().truncatedTo(ChronoUnit.MILLIS))));
    }
}
