package com.myorg.blockquota.jdbc.ledger;

import com.myorg.blockquota.contracts.quota.QuotaUsage;
import com.myorg.blockquota.contracts.quota.Reservation;
import com.myorg.blockquota.jdbc.JdbcLedgerTx;
import com.myorg.blockquota.ledger.LedgerTx;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Row level access to {@code quota_usages} and {@code reservations}.
 *
 * <p>The {@code lock*} methods issue {@code SELECT ... ORDER BY id FOR UPDATE} and must run inside the
 * given transaction so the row locks are held until it ends. Callers lock usages before reservations.
 */
@RequiredArgsConstructor
public class JdbcQuotaRepository {

    static final String USAGE_COLUMNS =
            "id, project_id, resource, in_use, reserved, until_refresh, created_at, updated_at";
    static final String RESERVATION_COLUMNS =
            "id, uuid, usage_id, project_id, resource, delta, expire, created_at";

    private final JdbcTemplate jdbc;

    public Map<String, QuotaUsage> lockUsages(LedgerTx tx, String projectId, Collection<String> resources) {
        if (resources.isEmpty()) return Map.of();
        String sql = """
                SELECT %s
                FROM quota_usages
                WHERE project_id = ?
                  AND resource IN (%s)
                ORDER BY id
                FOR UPDATE
                """.formatted(USAGE_COLUMNS, placeholders(resources.size()));

        List<Object> args = new ArrayList<>();
        args.add(projectId);
        args.addAll(resources);

        Map<String, QuotaUsage> byResource = new LinkedHashMap<>();
        for (QuotaUsage u : JdbcLedgerTx.of(tx).jdbc().query(sql, USAGE_MAPPER, args.toArray())) {
            byResource.put(u.getResource(), u);
        }
        return byResource;
    }

    /** @param projectId restricts the lock to one project; null locks the ids wherever they belong */
    public Map<Long, QuotaUsage> lockUsagesByIds(LedgerTx tx, String projectId, Collection<Long> usageIds) {
        if (usageIds.isEmpty()) return Map.of();
        String sql = """
                SELECT %s
                FROM quota_usages
                WHERE id IN (%s)%s
                ORDER BY id
                FOR UPDATE
                """.formatted(USAGE_COLUMNS, placeholders(usageIds.size()),
                projectId == null ? "" : "\n  AND project_id = ?");

        List<Object> args = new ArrayList<>(usageIds);
        if (projectId != null) args.add(projectId);

        Map<Long, QuotaUsage> byId = new LinkedHashMap<>();
        for (QuotaUsage u : JdbcLedgerTx.of(tx).jdbc().query(sql, USAGE_MAPPER, args.toArray())) {
            byId.put(u.getId(), u);
        }
        return byId;
    }

    public List<QuotaUsage> lockUsagesOfProject(LedgerTx tx, String projectId) {
        String sql = """
                SELECT %s
                FROM quota_usages
                WHERE project_id = ?
                ORDER BY id
                FOR UPDATE
                """.formatted(USAGE_COLUMNS);
        return JdbcLedgerTx.of(tx).jdbc().query(sql, USAGE_MAPPER, projectId);
    }

    public List<QuotaUsage> lockUsagesOfResource(LedgerTx tx, String resource) {
        String sql = """
                SELECT %s
                FROM quota_usages
                WHERE resource = ?
                ORDER BY id
                FOR UPDATE
                """.formatted(USAGE_COLUMNS);
        return JdbcLedgerTx.of(tx).jdbc().query(sql, USAGE_MAPPER, resource);
    }

    public void insertUsage(LedgerTx tx, String projectId, String resource, int inUse, int reserved,
                            Integer untilRefresh, Instant now) {
        String sql = """
                INSERT INTO quota_usages
                  (project_id, resource, in_use, reserved, until_refresh, created_at, updated_at)
                VALUES
                  (?, ?, ?, ?, ?, ?, ?)
                """;
        JdbcLedgerTx.of(tx).jdbc().update(sql,
                projectId,
                resource,
                inUse,
                reserved,
                untilRefresh,
                Timestamp.from(now),
                Timestamp.from(now)
        );
    }

    /** Usage ids referenced by the reservations; a plain read that takes no lock. */
    public Set<Long> findReservationUsageIds(LedgerTx tx, Collection<String> uuids) {
        if (uuids.isEmpty()) return Set.of();
        String sql = "SELECT DISTINCT usage_id FROM reservations WHERE uuid IN (%s)"
                .formatted(placeholders(uuids.size()));
        return new LinkedHashSet<>(JdbcLedgerTx.of(tx).jdbc().queryForList(sql, Long.class, uuids.toArray()));
    }

    public List<Reservation> lockReservations(LedgerTx tx, Collection<String> uuids) {
        if (uuids.isEmpty()) return List.of();
        String sql = """
                SELECT %s
                FROM reservations
                WHERE uuid IN (%s)
                ORDER BY id
                FOR UPDATE
                """.formatted(RESERVATION_COLUMNS, placeholders(uuids.size()));
        return JdbcLedgerTx.of(tx).jdbc().query(sql, RESERVATION_MAPPER, uuids.toArray());
    }

    public Set<Long> findExpiredUsageIds(LedgerTx tx, Instant now) {
        String sql = "SELECT DISTINCT usage_id FROM reservations WHERE expire < ?";
        return new LinkedHashSet<>(JdbcLedgerTx.of(tx).jdbc().queryForList(sql, Long.class, Timestamp.from(now)));
    }

    public List<Reservation> lockExpiredReservations(LedgerTx tx, Instant now, Collection<Long> usageIds) {
        if (usageIds.isEmpty()) return List.of();
        String sql = """
                SELECT %s
                FROM reservations
                WHERE expire < ?
                  AND usage_id IN (%s)
                ORDER BY id
                FOR UPDATE
                """.formatted(RESERVATION_COLUMNS, placeholders(usageIds.size()));

        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(now));
        args.addAll(usageIds);
        return JdbcLedgerTx.of(tx).jdbc().query(sql, RESERVATION_MAPPER, args.toArray());
    }

    public void insertReservation(LedgerTx tx, String uuid, long usageId, String projectId, String resource,
                                  int delta, Instant expire, Instant now) {
        String sql = """
                INSERT INTO reservations
                  (uuid, usage_id, project_id, resource, delta, expire, created_at)
                VALUES
                  (?, ?, ?, ?, ?, ?, ?)
                """;
        JdbcLedgerTx.of(tx).jdbc().update(sql,
                uuid,
                usageId,
                projectId,
                resource,
                delta,
                Timestamp.from(expire),
                Timestamp.from(now)
        );
    }

    public int deleteReservation(LedgerTx tx, long id) {
        return JdbcLedgerTx.of(tx).jdbc().update("DELETE FROM reservations WHERE id = ?", id);
    }

    public int deleteReservationsOfProject(LedgerTx tx, String projectId) {
        return JdbcLedgerTx.of(tx).jdbc().update("DELETE FROM reservations WHERE project_id = ?", projectId);
    }

    public int deleteUsagesOfProject(LedgerTx tx, String projectId) {
        return JdbcLedgerTx.of(tx).jdbc().update("DELETE FROM quota_usages WHERE project_id = ?", projectId);
    }

    // --- unlocked reads ---

    public List<QuotaUsage> findUsages(String projectId) {
        String sql = "SELECT %s FROM quota_usages WHERE project_id = ? ORDER BY resource".formatted(USAGE_COLUMNS);
        return jdbc.query(sql, USAGE_MAPPER, projectId);
    }

    public List<QuotaUsage> findUsage(String projectId, String resource) {
        String sql = "SELECT %s FROM quota_usages WHERE project_id = ? AND resource = ?".formatted(USAGE_COLUMNS);
        return jdbc.query(sql, USAGE_MAPPER, projectId, resource);
    }

    public List<Reservation> findReservations(String projectId) {
        String sql = "SELECT %s FROM reservations WHERE project_id = ? ORDER BY id".formatted(RESERVATION_COLUMNS);
        return jdbc.query(sql, RESERVATION_MAPPER, projectId);
    }

    public int countReservations() {
        Integer v = jdbc.queryForObject("SELECT COUNT(*) FROM reservations", Integer.class);
        return v == null ? 0 : v;
    }

    static String placeholders(int n) {
        return IntStream.range(0, n).mapToObj(i -> "?").collect(Collectors.joining(","));
    }

    static final RowMapper<QuotaUsage> USAGE_MAPPER = (rs, i) -> QuotaUsage.builder()
            .id(rs.getLong("id"))
            .projectId(rs.getString("project_id"))
            .resource(rs.getString("resource"))
            .inUse(rs.getInt("in_use"))
            .reserved(rs.getInt("reserved"))
            .untilRefresh(nullableInt(rs, "until_refresh"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();

    static final RowMapper<Reservation> RESERVATION_MAPPER = (rs, i) -> Reservation.builder()
            .id(rs.getLong("id"))
            .uuid(rs.getString("uuid"))
            .usageId(rs.getLong("usage_id"))
            .projectId(rs.getString("project_id"))
            .resource(rs.getString("resource"))
            .delta(rs.getInt("delta"))
            .expire(instant(rs, "expire"))
            .createdAt(instant(rs, "created_at"))
            .build();

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
