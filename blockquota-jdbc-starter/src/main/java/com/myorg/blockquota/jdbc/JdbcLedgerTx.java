package com.myorg.blockquota.jdbc;

import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;
import com.myorg.blockquota.ledger.LedgerTx;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;

import java.time.Instant;

/**
 * {@link LedgerTx} backed by a Spring managed JDBC transaction. Statements issued through
 * {@link #jdbc()} run on the transaction's connection.
 */
public final class JdbcLedgerTx implements LedgerTx {

    private final JdbcTemplate jdbc;
    private final TransactionStatus status;
    private final Instant startedAt;

    public JdbcLedgerTx(JdbcTemplate jdbc, TransactionStatus status, Instant startedAt) {
        this.jdbc = jdbc;
        this.status = status;
        this.startedAt = startedAt;
    }

    public static JdbcLedgerTx of(LedgerTx tx) {
        if (tx instanceof JdbcLedgerTx j) return j;
        throw new ProgrammingErrorException("Expected a JDBC ledger transaction but got "
                + (tx == null ? "null" : tx.getClass().getName()));
    }

    public JdbcTemplate jdbc() {
        if (status.isCompleted()) {
            throw new IllegalStateException("Ledger transaction already completed");
        }
        return jdbc;
    }

    @Override
    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public void setRollbackOnly() {
        status.setRollbackOnly();
    }
}
