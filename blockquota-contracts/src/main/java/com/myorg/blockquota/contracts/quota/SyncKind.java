package com.myorg.blockquota.contracts.quota;

/**
 * Which usage computation heals a resource. Per volume type resources share the kind of their base
 * resource, e.g. {@code volumes_lvm} syncs with {@link #VOLUMES}.
 */
public enum SyncKind {
    VOLUMES,
    SNAPSHOTS,
    GIGABYTES,
    BACKUPS,
    BACKUP_GIGABYTES,
    GROUPS
}
