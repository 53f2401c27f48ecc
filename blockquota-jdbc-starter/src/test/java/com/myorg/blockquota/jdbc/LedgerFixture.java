package com.myorg.blockquota.jdbc;

import com.myorg.blockquota.jdbc.ledger.JdbcQuotaLedger;
import com.myorg.blockquota.jdbc.ledger.JdbcQuotaRepository;
import com.myorg.blockquota.jdbc.ledger.JdbcQuotaStore;
import com.myorg.blockquota.jdbc.retry.DefaultStoreErrorClassifier;
import com.myorg.blockquota.jdbc.retry.StoreRetry;
import com.myorg.blockquota.jdbc.sync.JdbcResourceSyncFunctions;
import com.myorg.blockquota.jdbc.update.JdbcConditionalUpdater;
import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.sync.ResourceSyncRegistry;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Wires the JDBC ledger by hand over a migrated database, without a Spring context.
 */
public class LedgerFixture {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    public final DataSource ds;
    public final JdbcTemplate jdbc;
    public final MutableClock clock = new MutableClock(T0);
    public final BlockQuotaProperties props = new BlockQuotaProperties();
    public final LedgerTransactions transactions;
    public final StoreRetry retry;
    public final JdbcQuotaRepository repo;
    public final JdbcConditionalUpdater updater;
    public final JdbcQuotaStore store;

    public LedgerFixture(DataSource ds, String migrations) {
        Flyway.configure()
                .dataSource(ds)
                .locations(migrations)
                .load()
                .migrate();

        this.ds = ds;
        this.jdbc = new JdbcTemplate(ds);

        props.getRetry().setBackoffBase(Duration.ofMillis(1));
        props.getRetry().setBackoffMax(Duration.ofMillis(5));

        this.transactions = new JdbcLedgerTransactions(new DataSourceTransactionManager(ds), jdbc, clock);
        this.retry = new StoreRetry(props.getRetry(), new DefaultStoreErrorClassifier(), d -> {}, null);
        this.repo = new JdbcQuotaRepository(jdbc);
        this.updater = new JdbcConditionalUpdater(transactions, retry);
        this.store = new JdbcQuotaStore(jdbc, transactions, repo, updater, retry, clock);
    }

    /** Fresh in-memory database per call. */
    public static LedgerFixture h2() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:bq_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        ds.setPassword("sa");
        return new LedgerFixture(ds, "classpath:db/migration/mysql");
    }

    public ResourceSyncRegistry domainSync() {
        return new JdbcResourceSyncFunctions(props.isNoSnapshotGbQuota()).registry();
    }

    public JdbcQuotaLedger ledger() {
        return ledger(domainSync());
    }

    public JdbcQuotaLedger ledger(ResourceSyncRegistry sync) {
        return new JdbcQuotaLedger(props, transactions, repo, updater, sync, store, retry, null, clock);
    }

    public void insertVolume(String id, String projectId, int size, String volumeTypeId) {
        jdbc.update("""
                INSERT INTO volumes (id, project_id, size, status, volume_type_id, use_quota, deleted, created_at)
                VALUES (?, ?, ?, 'available', ?, TRUE, FALSE, ?)
                """, id, projectId, size, volumeTypeId, Timestamp.from(T0));
    }

    public void insertSnapshot(String id, String projectId, String volumeId, int volumeSize, String volumeTypeId) {
        jdbc.update("""
                INSERT INTO snapshots (id, project_id, volume_id, volume_size, status, volume_type_id, use_quota, deleted, created_at)
                VALUES (?, ?, ?, ?, 'available', ?, TRUE, FALSE, ?)
                """, id, projectId, volumeId, volumeSize, volumeTypeId, Timestamp.from(T0));
    }

    public void insertBackup(String id, String projectId, String volumeId, int size) {
        insertBackup(id, projectId, volumeId, size, null);
    }

    public void insertBackup(String id, String projectId, String volumeId, int size, String volumeTypeId) {
        jdbc.update("""
                INSERT INTO backups (id, project_id, volume_id, size, status, volume_type_id, deleted, created_at)
                VALUES (?, ?, ?, ?, 'available', ?, FALSE, ?)
                """, id, projectId, volumeId, size, volumeTypeId, Timestamp.from(T0));
    }

    public void insertGroup(String id, String projectId) {
        jdbc.update("""
                INSERT INTO volume_groups (id, project_id, status, deleted, created_at)
                VALUES (?, ?, 'available', FALSE, ?)
                """, id, projectId, Timestamp.from(T0));
    }

    public int countReservations() {
        return repo.countReservations();
    }
}
