package com.myorg.blockquota.jdbc.ledger;

import com.myorg.blockquota.contracts.quota.Quota;
import com.myorg.blockquota.contracts.quota.QuotaClass;
import com.myorg.blockquota.contracts.quota.QuotaUsage;
import com.myorg.blockquota.jdbc.JdbcLedgerTx;
import com.myorg.blockquota.jdbc.retry.StoreRetry;
import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.QuotaStore;
import com.myorg.blockquota.ledger.update.ConditionalUpdate;
import com.myorg.blockquota.ledger.update.ConditionalUpdater;
import com.myorg.blockquota.ledger.update.EntityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class JdbcQuotaStore implements QuotaStore {

    private final JdbcTemplate jdbc;
    private final LedgerTransactions transactions;
    private final JdbcQuotaRepository repo;
    private final ConditionalUpdater updater;
    private final StoreRetry retry;
    private final Clock clock;

    @Override
    public Quota createQuota(String projectId, String resource, int hardLimit) {
        long id = insert("INSERT INTO quotas (project_id, resource, hard_limit, created_at) VALUES (?, ?, ?, ?)",
                projectId, resource, hardLimit);
        return Quota.builder().id(id).projectId(projectId).resource(resource).hardLimit(hardLimit).build();
    }

    @Override
    public boolean updateQuota(String projectId, String resource, int hardLimit) {
        return updater.conditionalUpdate(ConditionalUpdate.on(EntityRegistry.QUOTAS)
                .set("hard_limit", hardLimit)
                .expect("project_id", projectId)
                .expect("resource", resource)
                .build());
    }

    @Override
    public boolean destroyQuota(String projectId, String resource) {
        return jdbc.update("DELETE FROM quotas WHERE project_id = ? AND resource = ?", projectId, resource) > 0;
    }

    @Override
    public Optional<Quota> getQuota(String projectId, String resource) {
        String sql = "SELECT id, project_id, resource, hard_limit FROM quotas WHERE project_id = ? AND resource = ?";
        return jdbc.query(sql, QUOTA_MAPPER, projectId, resource).stream().findFirst();
    }

    @Override
    public Map<String, Integer> getAllQuotas(String projectId) {
        String sql = "SELECT id, project_id, resource, hard_limit FROM quotas WHERE project_id = ? ORDER BY resource";
        Map<String, Integer> limits = new LinkedHashMap<>();
        for (Quota q : jdbc.query(sql, QUOTA_MAPPER, projectId)) {
            limits.put(q.getResource(), q.getHardLimit());
        }
        return limits;
    }

    @Override
    public QuotaClass createQuotaClass(String className, String resource, int hardLimit) {
        long id = insert("INSERT INTO quota_classes (class_name, resource, hard_limit, created_at) VALUES (?, ?, ?, ?)",
                className, resource, hardLimit);
        return QuotaClass.builder().id(id).className(className).resource(resource).hardLimit(hardLimit).build();
    }

    @Override
    public boolean updateQuotaClass(String className, String resource, int hardLimit) {
        return updater.conditionalUpdate(ConditionalUpdate.on(EntityRegistry.QUOTA_CLASSES)
                .set("hard_limit", hardLimit)
                .expect("class_name", className)
                .expect("resource", resource)
                .build());
    }

    @Override
    public Optional<QuotaClass> getQuotaClass(String className, String resource) {
        String sql = "SELECT id, class_name, resource, hard_limit FROM quota_classes WHERE class_name = ? AND resource = ?";
        return jdbc.query(sql, QUOTA_CLASS_MAPPER, className, resource).stream().findFirst();
    }

    @Override
    public Map<String, Integer> getQuotaClassDefaults() {
        return getAllQuotaClasses(QuotaClass.DEFAULT_CLASS);
    }

    @Override
    public Map<String, Integer> getAllQuotaClasses(String className) {
        String sql = "SELECT id, class_name, resource, hard_limit FROM quota_classes WHERE class_name = ? ORDER BY resource";
        Map<String, Integer> limits = new LinkedHashMap<>();
        for (QuotaClass c : jdbc.query(sql, QUOTA_CLASS_MAPPER, className)) {
            limits.put(c.getResource(), c.getHardLimit());
        }
        return limits;
    }

    @Override
    public boolean destroyQuotaClass(String className, String resource) {
        return jdbc.update("DELETE FROM quota_classes WHERE class_name = ? AND resource = ?", className, resource) > 0;
    }

    @Override
    public int destroyAllQuotaClasses(String className) {
        return jdbc.update("DELETE FROM quota_classes WHERE class_name = ?", className);
    }

    @Override
    public void renameResource(String oldResource, String newResource) {
        retry.execute("rename_resource", StoreRetry.ON_DEADLOCK, () -> transactions.inTransaction(tx -> {
            JdbcTemplate t = JdbcLedgerTx.of(tx).jdbc();
            t.update("UPDATE quotas SET resource = ?, updated_at = ? WHERE resource = ?",
                    newResource, Timestamp.from(tx.startedAt()), oldResource);
            t.update("UPDATE quota_classes SET resource = ?, updated_at = ? WHERE resource = ?",
                    newResource, Timestamp.from(tx.startedAt()), oldResource);

            List<QuotaUsage> usages = repo.lockUsagesOfResource(tx, oldResource);
            for (QuotaUsage u : usages) {
                // force a refresh on the next reservation
                updater.conditionalUpdate(tx, ConditionalUpdate.on(EntityRegistry.QUOTA_USAGES)
                        .set("resource", newResource)
                        .set("until_refresh", 1)
                        .expect("id", u.getId())
                        .build());
            }
            log.info("Renamed resource {} -> {} usages={}", oldResource, newResource, usages.size());
            return usages.size();
        }));
    }

    @Override
    public int destroyQuotasByProject(String projectId) {
        return jdbc.update("DELETE FROM quotas WHERE project_id = ?", projectId);
    }

    @Override
    public void destroyAllByProject(String projectId) {
        retry.execute("destroy_all_by_project", StoreRetry.ON_DEADLOCK, () -> transactions.inTransaction(tx -> {
            repo.lockUsagesOfProject(tx, projectId);
            int reservations = repo.deleteReservationsOfProject(tx, projectId);
            int usages = repo.deleteUsagesOfProject(tx, projectId);
            int quotas = JdbcLedgerTx.of(tx).jdbc().update("DELETE FROM quotas WHERE project_id = ?", projectId);
            log.info("Destroyed project={} quotas={} usages={} reservations={}", projectId, quotas, usages, reservations);
            return quotas;
        }));
    }

    private long insert(String sql, String owner, String resource, int hardLimit) {
        KeyHolder keys = new GeneratedKeyHolder();
        Timestamp now = Timestamp.from(clock.instant());
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[] {"id"});
            ps.setString(1, owner);
            ps.setString(2, resource);
            ps.setInt(3, hardLimit);
            ps.setTimestamp(4, now);
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) throw new IllegalStateException("No id returned from insert");
        return id.longValue();
    }

    static final RowMapper<Quota> QUOTA_MAPPER = (rs, i) -> Quota.builder()
            .id(rs.getLong("id"))
            .projectId(rs.getString("project_id"))
            .resource(rs.getString("resource"))
            .hardLimit(rs.getInt("hard_limit"))
            .build();

    static final RowMapper<QuotaClass> QUOTA_CLASS_MAPPER = (rs, i) -> QuotaClass.builder()
            .id(rs.getLong("id"))
            .className(rs.getString("class_name"))
            .resource(rs.getString("resource"))
            .hardLimit(rs.getInt("hard_limit"))
            .build();
}
