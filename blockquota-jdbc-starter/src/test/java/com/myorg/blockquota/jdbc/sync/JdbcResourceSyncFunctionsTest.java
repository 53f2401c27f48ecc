package com.myorg.blockquota.jdbc.sync;

import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.contracts.quota.SyncKind;
import com.myorg.blockquota.jdbc.LedgerFixture;
import com.myorg.blockquota.ledger.sync.ResourceSyncRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcResourceSyncFunctionsTest {

    private LedgerFixture f;

    @BeforeEach
    void setUp() {
        f = LedgerFixture.h2();

        f.insertVolume("v1", "p1", 10, "lvm-id");
        f.insertVolume("v2", "p1", 20, "ceph-id");
        f.insertVolume("v3", "p1", 40, "lvm-id");
        f.insertVolume("v4", "p2", 80, "lvm-id");
        f.jdbc.update("UPDATE volumes SET deleted = TRUE WHERE id = 'v3'");

        f.insertSnapshot("s1", "p1", "v1", 10, "lvm-id");
        f.insertSnapshot("s2", "p1", "v2", 20, "ceph-id");
        f.jdbc.update("UPDATE snapshots SET use_quota = FALSE WHERE id = 's2'");

        f.insertBackup("b1", "p1", "v1", 10, "lvm-id");
        f.insertBackup("b2", "p1", "v2", 20, "ceph-id");

        f.insertGroup("g1", "p1");
    }

    private int sync(ResourceSyncRegistry registry, QuotaResource resource) {
        return f.transactions.inTransaction(tx -> registry.sync(tx, "p1", resource));
    }

    @Test
    void counts_skipDeletedAndNonQuotaRows() {
        ResourceSyncRegistry registry = f.domainSync();

        assertEquals(2, sync(registry, QuotaResource.of("volumes", SyncKind.VOLUMES)));
        assertEquals(1, sync(registry, QuotaResource.of("snapshots", SyncKind.SNAPSHOTS)));
        assertEquals(2, sync(registry, QuotaResource.of("backups", SyncKind.BACKUPS)));
        assertEquals(30, sync(registry, QuotaResource.of("backup_gigabytes", SyncKind.BACKUP_GIGABYTES)));
        assertEquals(1, sync(registry, QuotaResource.of("groups", SyncKind.GROUPS)));
    }

    @Test
    void gigabytes_includeSnapshotsUnlessDisabled() {
        QuotaResource gigabytes = QuotaResource.of("gigabytes", SyncKind.GIGABYTES);

        assertEquals(40, sync(f.domainSync(), gigabytes));
        assertEquals(30, sync(new JdbcResourceSyncFunctions(true).registry(), gigabytes));
    }

    @Test
    void volumeTypeResources_countOnlyThatType() {
        ResourceSyncRegistry registry = f.domainSync();

        assertEquals(1, sync(registry, QuotaResource.forVolumeType(SyncKind.VOLUMES, "volumes", "lvm-id", "lvm")));
        assertEquals(20, sync(registry, QuotaResource.forVolumeType(SyncKind.GIGABYTES, "gigabytes", "lvm-id", "lvm")));
        assertEquals(0, sync(registry, QuotaResource.forVolumeType(SyncKind.SNAPSHOTS, "snapshots", "ceph-id", "ceph")));
    }

    @Test
    void backupResources_filterByVolumeType() {
        ResourceSyncRegistry registry = f.domainSync();
        f.insertBackup("b3", "p1", "v1", 5, "lvm-id");
        f.jdbc.update("UPDATE backups SET deleted = TRUE WHERE id = 'b3'");

        assertEquals(1, sync(registry, QuotaResource.forVolumeType(SyncKind.BACKUPS, "backups", "lvm-id", "lvm")));
        assertEquals(20, sync(registry,
                QuotaResource.forVolumeType(SyncKind.BACKUP_GIGABYTES, "backup_gigabytes", "ceph-id", "ceph")));
        assertEquals(0, sync(registry, QuotaResource.forVolumeType(SyncKind.BACKUPS, "backups", "other-id", "other")));
        assertEquals(30, sync(registry, QuotaResource.of("backup_gigabytes", SyncKind.BACKUP_GIGABYTES)));
    }

    @Test
    void emptyProject_countsZero() {
        int n = f.transactions.inTransaction(tx -> f.domainSync().sync(tx, "nobody",
                QuotaResource.of("gigabytes", SyncKind.GIGABYTES)));

        assertEquals(0, n);
    }
}
