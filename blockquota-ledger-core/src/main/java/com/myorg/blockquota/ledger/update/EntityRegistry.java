package com.myorg.blockquota.ledger.update;

import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Every entity type the conditional update primitive knows about. Built once, never mutated.
 */
public final class EntityRegistry {

    public static final EntityType VOLUMES = new EntityType("volume", "volumes", "id", Set.of(
            "id", "project_id", "size", "status", "previous_status", "volume_type_id", "use_quota",
            "deleted", "created_at", "updated_at"));

    public static final EntityType SNAPSHOTS = new EntityType("snapshot", "snapshots", "id", Set.of(
            "id", "project_id", "volume_id", "volume_size", "status", "volume_type_id", "use_quota",
            "deleted", "created_at", "updated_at"));

    public static final EntityType BACKUPS = new EntityType("backup", "backups", "id", Set.of(
            "id", "project_id", "volume_id", "size", "status", "volume_type_id", "deleted", "created_at",
            "updated_at"));

    public static final EntityType VOLUME_GROUPS = new EntityType("group", "volume_groups", "id", Set.of(
            "id", "project_id", "status", "deleted", "created_at", "updated_at"));

    public static final EntityType QUOTAS = new EntityType("quota", "quotas", "id", Set.of(
            "id", "project_id", "resource", "hard_limit", "created_at", "updated_at"));

    public static final EntityType QUOTA_CLASSES = new EntityType("quota_class", "quota_classes", "id", Set.of(
            "id", "class_name", "resource", "hard_limit", "created_at", "updated_at"));

    public static final EntityType QUOTA_USAGES = new EntityType("quota_usage", "quota_usages", "id", Set.of(
            "id", "project_id", "resource", "in_use", "reserved", "until_refresh", "created_at", "updated_at"));

    public static final EntityType RESERVATIONS = new EntityType("reservation", "reservations", "id", Set.of(
            "id", "uuid", "usage_id", "project_id", "resource", "delta", "expire", "created_at"));

    private static final Map<String, EntityType> BY_NAME;

    static {
        Map<String, EntityType> m = new LinkedHashMap<>();
        for (EntityType t : new EntityType[] {
                VOLUMES, SNAPSHOTS, BACKUPS, VOLUME_GROUPS, QUOTAS, QUOTA_CLASSES, QUOTA_USAGES, RESERVATIONS }) {
            m.put(t.name(), t);
        }
        BY_NAME = Map.copyOf(m);
    }

    private EntityRegistry() {}

    public static EntityType get(String name) {
        EntityType t = BY_NAME.get(name);
        if (t == null) throw new ProgrammingErrorException("Unknown entity type " + name);
        return t;
    }

    public static Set<String> names() {
        return BY_NAME.keySet();
    }
}
