package com.myorg.blockquota.jdbc.sync;

import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.contracts.quota.SyncKind;
import com.myorg.blockquota.jdbc.JdbcLedgerTx;
import com.myorg.blockquota.ledger.LedgerTx;
import com.myorg.blockquota.ledger.sync.ResourceSyncRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Usage recomputation over the {@code volumes}, {@code snapshots}, {@code backups} and
 * {@code volume_groups} tables. Soft-deleted rows never count; volumes and snapshots also need
 * {@code use_quota}. A resource bound to a volume type only counts volumes, snapshots and backups of
 * that type.
 */
public class JdbcResourceSyncFunctions {

    private final boolean noSnapshotGbQuota;

    public JdbcResourceSyncFunctions(boolean noSnapshotGbQuota) {
        this.noSnapshotGbQuota = noSnapshotGbQuota;
    }

    public ResourceSyncRegistry registry() {
        return ResourceSyncRegistry.builder()
                .register(SyncKind.VOLUMES, this::volumes)
                .register(SyncKind.SNAPSHOTS, this::snapshots)
                .register(SyncKind.GIGABYTES, this::gigabytes)
                .register(SyncKind.BACKUPS, this::backups)
                .register(SyncKind.BACKUP_GIGABYTES, this::backupGigabytes)
                .register(SyncKind.GROUPS, this::groups)
                .build();
    }

    int volumes(LedgerTx tx, String projectId, QuotaResource resource) {
        return typed(tx, "SELECT COUNT(*) FROM volumes", true, projectId, resource);
    }

    int snapshots(LedgerTx tx, String projectId, QuotaResource resource) {
        return typed(tx, "SELECT COUNT(*) FROM snapshots", true, projectId, resource);
    }

    int gigabytes(LedgerTx tx, String projectId, QuotaResource resource) {
        int total = typed(tx, "SELECT COALESCE(SUM(size), 0) FROM volumes", true, projectId, resource);
        if (!noSnapshotGbQuota) {
            total += typed(tx, "SELECT COALESCE(SUM(volume_size), 0) FROM snapshots", true, projectId, resource);
        }
        return total;
    }

    int backups(LedgerTx tx, String projectId, QuotaResource resource) {
        return typed(tx, "SELECT COUNT(*) FROM backups", false, projectId, resource);
    }

    int backupGigabytes(LedgerTx tx, String projectId, QuotaResource resource) {
        return typed(tx, "SELECT COALESCE(SUM(size), 0) FROM backups", false, projectId, resource);
    }

    int groups(LedgerTx tx, String projectId, QuotaResource resource) {
        return query(tx, "SELECT COUNT(*) FROM volume_groups WHERE project_id = ? AND deleted = FALSE", projectId);
    }

    private int typed(LedgerTx tx, String select, boolean useQuota, String projectId, QuotaResource resource) {
        StringBuilder sql = new StringBuilder(select).append(" WHERE project_id = ? AND deleted = FALSE");
        if (useQuota) sql.append(" AND use_quota = TRUE");
        List<Object> args = new ArrayList<>();
        args.add(projectId);
        if (resource.volumeTypeId() != null) {
            sql.append(" AND volume_type_id = ?");
            args.add(resource.volumeTypeId());
        }
        return query(tx, sql.toString(), args.toArray());
    }

    private static int query(LedgerTx tx, String sql, Object... args) {
        Long n = JdbcLedgerTx.of(tx).jdbc().queryForObject(sql, Long.class, args);
        return n == null ? 0 : n.intValue();
    }
}
