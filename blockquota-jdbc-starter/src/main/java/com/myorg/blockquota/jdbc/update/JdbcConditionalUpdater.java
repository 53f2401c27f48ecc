package com.myorg.blockquota.jdbc.update;

import com.myorg.blockquota.jdbc.JdbcLedgerTx;
import com.myorg.blockquota.jdbc.retry.StoreRetry;
import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.LedgerTx;
import com.myorg.blockquota.ledger.update.ConditionalUpdate;
import com.myorg.blockquota.ledger.update.ConditionalUpdater;
import com.myorg.blockquota.ledger.update.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class JdbcConditionalUpdater implements ConditionalUpdater {

    private final LedgerTransactions transactions;
    private final StoreRetry retry;

    @Override
    public boolean conditionalUpdate(LedgerTx tx, ConditionalUpdate update) {
        SqlStatement st = ConditionalUpdateSql.render(update, tx.startedAt());
        int rows = JdbcLedgerTx.of(tx).jdbc().update(st.sql(), st.argArray());
        log.debug("Conditional update {} matched rows={}", update, rows);
        return rows != 0;
    }

    @Override
    public boolean conditionalUpdate(ConditionalUpdate update) {
        Boolean changed = retry.run("conditional_update", StoreRetry.ON_DEADLOCK,
                () -> transactions.inTransaction(tx -> conditionalUpdate(tx, update)));
        return Boolean.TRUE.equals(changed);
    }

    @Override
    public Optional<Map<String, Object>> get(LedgerTx tx, EntityType entity, Object id) {
        String sql = "SELECT * FROM " + entity.table() + " WHERE " + entity.idColumn() + " = ?";
        List<Map<String, Object>> rows = JdbcLedgerTx.of(tx).jdbc().queryForList(sql, id);
        return rows.stream().findFirst();
    }
}
