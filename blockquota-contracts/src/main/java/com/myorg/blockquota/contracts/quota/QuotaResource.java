package com.myorg.blockquota.contracts.quota;

import java.util.Objects;

/**
 * A countable resource tracked per project.
 *
 * @param name           ledger key, e.g. {@code gigabytes} or {@code gigabytes_lvm}
 * @param sync           usage computation used to create or heal the usage row
 * @param volumeTypeId   restricts the computation to one volume type, may be null
 * @param volumeTypeName suffix of per volume type resource names, may be null
 */
public record QuotaResource(String name, SyncKind sync, String volumeTypeId, String volumeTypeName) {

    public QuotaResource {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sync, "sync");
    }

    public static QuotaResource of(String name, SyncKind sync) {
        return new QuotaResource(name, sync, null, null);
    }

    public static QuotaResource forVolumeType(SyncKind sync, String baseName, String volumeTypeId, String volumeTypeName) {
        return new QuotaResource(baseName + "_" + volumeTypeName, sync, volumeTypeId, volumeTypeName);
    }
}
