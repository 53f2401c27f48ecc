package com.myorg.blockquota.jdbc.ledger;

import com.myorg.blockquota.contracts.core.exception.DataIntegrityFaultException;
import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;
import com.myorg.blockquota.contracts.quota.OverQuotaDetail;
import com.myorg.blockquota.contracts.quota.Quota;
import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.contracts.quota.QuotaUsage;
import com.myorg.blockquota.contracts.quota.Reservation;
import com.myorg.blockquota.contracts.quota.ReserveRequest;
import com.myorg.blockquota.contracts.quota.ReserveResult;
import com.myorg.blockquota.contracts.quota.UsageSnapshot;
import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import com.myorg.blockquota.jdbc.QuotaLedgerMetrics;
import com.myorg.blockquota.jdbc.retry.StoreRetry;
import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.LedgerTx;
import com.myorg.blockquota.ledger.QuotaLedger;
import com.myorg.blockquota.ledger.QuotaStore;
import com.myorg.blockquota.ledger.observability.LedgerContext;
import com.myorg.blockquota.ledger.observability.LedgerMdc;
import com.myorg.blockquota.ledger.sync.ResourceSyncRegistry;
import com.myorg.blockquota.ledger.update.ConditionalUpdate;
import com.myorg.blockquota.ledger.update.ConditionalUpdater;
import com.myorg.blockquota.ledger.update.EntityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * JDBC implementation of the reserve / commit / rollback / expire protocol.
 *
 * <p>Lock order, on every path: {@code quota_usages} rows first, then {@code reservations} rows, each in
 * ascending id. Usage changes are written back with a conditional update expecting the values read under
 * the lock; a miss there means someone bypassed the locks.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcQuotaLedger implements QuotaLedger {

    private final BlockQuotaProperties props;
    private final LedgerTransactions transactions;
    private final JdbcQuotaRepository repo;
    private final ConditionalUpdater updater;
    private final ResourceSyncRegistry syncRegistry;
    private final QuotaStore quotaStore;
    private final StoreRetry retry;
    private final QuotaLedgerMetrics metrics; // may be null
    private final Clock clock;

    @Override
    public ReserveResult reserve(ReserveRequest request) {
        validate(request);
        ReserveParams p = paramsOf(request);
        return withMdc("reserve", request.getProjectId(), () -> {
            ReserveResult result = retry.run("reserve", StoreRetry.ON_DEADLOCK_OR_DUPLICATE,
                    () -> reserveUntilLocked(request, p));
            if (metrics != null) {
                if (result.isReserved()) metrics.incCreated(result.reservations().size());
                else metrics.incOverQuota();
            }
            return result;
        });
    }

    private ReserveResult reserveUntilLocked(ReserveRequest request, ReserveParams p) {
        String projectId = request.getProjectId();
        Set<String> resources = request.getDeltas().keySet();

        // Loop until every usage row exists and is locked. FOR UPDATE cannot lock a missing row, so
        // missing rows are created and committed on their own, then everything is locked again.
        // Another caller creating the same row surfaces as a duplicate key or deadlock, which aborts
        // this attempt and lets the retry start over.
        while (true) {
            ReserveResult result = transactions.inTransaction(tx -> {
                Map<String, QuotaUsage> usages = repo.lockUsages(tx, projectId, resources);
                List<String> missing = resources.stream().filter(r -> !usages.containsKey(r)).toList();
                if (missing.isEmpty()) {
                    return reserveLocked(tx, request, p, usages);
                }

                for (String resource : missing) {
                    int inUse = syncRegistry.sync(tx, projectId, request.getResources().get(resource));
                    repo.insertUsage(tx, projectId, resource, inUse, 0, p.untilRefresh(), tx.startedAt());
                }
                log.debug("Created usage rows project={} resources={}", projectId, missing);
                return null;
            });
            if (result != null) return result;
        }
    }

    private ReserveResult reserveLocked(LedgerTx tx, ReserveRequest request, ReserveParams p,
                                        Map<String, QuotaUsage> usages) {
        String projectId = request.getProjectId();
        Map<String, Integer> deltas = request.getDeltas();
        Map<String, Integer> quotas = request.getQuotas();
        Map<Long, QuotaUsage> before = copyOf(usages.values());

        for (String resource : deltas.keySet()) {
            QuotaUsage usage = usages.get(resource);
            if (needsRefresh(usage, p.maxAge(), tx.startedAt())) {
                usage.setInUse(syncRegistry.sync(tx, projectId, request.getResources().get(resource)));
                usage.setUntilRefresh(p.untilRefresh());
                log.info("Refreshed usage project={} resource={} inUse={}", projectId, resource, usage.getInUse());
            } else {
                // only when turning it on, turning it off, or lowering it
                Integer current = usage.getUntilRefresh();
                if ((current == null && p.untilRefresh() != null)
                        || orZero(current) > orZero(p.untilRefresh())) {
                    usage.setUntilRefresh(p.untilRefresh());
                }
            }
        }

        List<String> unders = new ArrayList<>();
        List<String> overs = new ArrayList<>();
        for (Map.Entry<String, Integer> e : deltas.entrySet()) {
            String resource = e.getKey();
            int delta = e.getValue();
            QuotaUsage usage = usages.get(resource);
            int limit = quotas.get(resource);

            if (delta < 0 && (long) delta + usage.getInUse() < 0) unders.add(resource);
            // only positive increments are checked so over-quota projects can still shrink
            if (delta >= 0) {
                long wanted = delta + usage.total();
                // the usage columns are INT, so even an unlimited quota cannot go past that
                if ((limit >= 0 && limit < wanted) || wanted > Integer.MAX_VALUE) overs.add(resource);
            }
        }

        List<String> reservations = new ArrayList<>();
        if (overs.isEmpty()) {
            for (Map.Entry<String, Integer> e : deltas.entrySet()) {
                QuotaUsage usage = usages.get(e.getKey());
                int delta = e.getValue();
                String uuid = UUID.randomUUID().toString();
                repo.insertReservation(tx, uuid, usage.getId(), projectId, e.getKey(), delta,
                        p.expire(), tx.startedAt());
                reservations.add(uuid);

                // a negative delta must not free room for a concurrent request before it is committed
                if (delta > 0) usage.setReserved(usage.getReserved() + delta);
            }
        }

        writeBack(tx, before, usages.values());

        if (!unders.isEmpty()) {
            log.warn("Reservation would make usage less than 0 for the following resources, "
                    + "so on commit they will be limited to prevent going below 0: {}", unders);
        }
        if (!overs.isEmpty()) {
            overs.sort(null);
            Map<String, UsageSnapshot> snapshot = new LinkedHashMap<>();
            usages.forEach((r, u) -> snapshot.put(r, u.snapshot()));
            log.info("Over quota project={} overs={}", projectId, overs);
            // refreshed usage is still committed: it is valid whatever happens to this request
            return ReserveResult.overQuota(new OverQuotaDetail(overs, quotas, snapshot));
        }
        return ReserveResult.reserved(reservations);
    }

    /** Also counts {@code until_refresh} down by one when it is set. */
    static boolean needsRefresh(QuotaUsage usage, Duration maxAge, Instant now) {
        if (usage.getInUse() < 0) {
            // negative in_use means an earlier desync
            return true;
        }
        if (usage.getUntilRefresh() != null) {
            usage.setUntilRefresh(usage.getUntilRefresh() - 1);
            return usage.getUntilRefresh() <= 0;
        }
        return maxAge != null
                && !maxAge.isZero()
                && usage.getUpdatedAt() != null
                && Duration.between(usage.getUpdatedAt(), now).compareTo(maxAge) >= 0;
    }

    @Override
    public void commit(Collection<String> reservationUuids, String projectId) {
        if (reservationUuids == null || reservationUuids.isEmpty()) return;
        Set<String> uuids = new LinkedHashSet<>(reservationUuids);
        withMdc("commit", projectId, () -> {
            int n = retry.run("commit", StoreRetry.ON_DEADLOCK,
                    () -> resolve(uuids, projectId, (usage, r) -> {
                        int delta = r.getDelta();
                        if (delta >= 0) {
                            usage.setReserved(usage.getReserved() - Math.min(delta, usage.getReserved()));
                        } else if ((long) usage.getInUse() + delta < 0) {
                            // never drive in_use below zero
                            delta = -usage.getInUse();
                        }
                        usage.setInUse((int) Math.min(Integer.MAX_VALUE, (long) usage.getInUse() + delta));
                    }));
            if (metrics != null) metrics.incCommitted(n);
            return n;
        });
    }

    @Override
    public void rollback(Collection<String> reservationUuids, String projectId) {
        if (reservationUuids == null || reservationUuids.isEmpty()) return;
        Set<String> uuids = new LinkedHashSet<>(reservationUuids);
        withMdc("rollback", projectId, () -> {
            int n = retry.run("rollback", StoreRetry.ON_DEADLOCK,
                    () -> resolve(uuids, projectId, JdbcQuotaLedger::release));
            if (metrics != null) metrics.incRolledBack(n);
            return n;
        });
    }

    @Override
    public int expire(Instant now) {
        return withMdc("expire", null, () -> {
            int n = retry.run("expire", StoreRetry.ON_DEADLOCK, () -> transactions.inTransaction(tx -> {
                Set<Long> usageIds = repo.findExpiredUsageIds(tx, now);
                if (usageIds.isEmpty()) return 0;

                Map<Long, QuotaUsage> usages = repo.lockUsagesByIds(tx, null, usageIds);
                Map<Long, QuotaUsage> before = copyOf(usages.values());
                int removed = 0;
                for (Reservation r : repo.lockExpiredReservations(tx, now, usageIds)) {
                    removed += resolveOne(tx, usages, r, JdbcQuotaLedger::release);
                }
                writeBack(tx, before, usages.values());
                return removed;
            }));
            if (n > 0) log.info("Expired reservations count={}", n);
            if (metrics != null) metrics.incExpired(n);
            return n;
        });
    }

    private static void release(QuotaUsage usage, Reservation r) {
        // negative deltas never added to reserved
        if (r.getDelta() >= 0) {
            usage.setReserved(usage.getReserved() - Math.min(r.getDelta(), usage.getReserved()));
        }
    }

    private int resolve(Set<String> uuids, String projectId, Resolution resolution) {
        return transactions.inTransaction(tx -> {
            // Unlocked pre-read: which usage rows to lock before the reservations themselves.
            Set<Long> usageIds = repo.findReservationUsageIds(tx, uuids);
            if (usageIds.isEmpty()) return 0;

            Map<Long, QuotaUsage> usages = repo.lockUsagesByIds(tx, projectId, usageIds);
            Map<Long, QuotaUsage> before = copyOf(usages.values());
            int resolved = 0;
            for (Reservation r : repo.lockReservations(tx, uuids)) {
                resolved += resolveOne(tx, usages, r, resolution);
            }
            writeBack(tx, before, usages.values());
            return resolved;
        });
    }

    private int resolveOne(LedgerTx tx, Map<Long, QuotaUsage> usages, Reservation r, Resolution resolution) {
        QuotaUsage usage = usages.get(r.getUsageId());
        if (usage == null) {
            log.error("Reservation uuid={} references usage id={} which is not locked for project={}",
                    r.getUuid(), r.getUsageId(), r.getProjectId());
            throw new DataIntegrityFaultException("Usage row id=" + r.getUsageId()
                    + " of reservation " + r.getUuid() + " not found");
        }
        if (repo.deleteReservation(tx, r.getId()) == 0) return 0;
        resolution.apply(usage, r);
        return 1;
    }

    private void writeBack(LedgerTx tx, Map<Long, QuotaUsage> before, Collection<QuotaUsage> after) {
        for (QuotaUsage u : after) {
            QuotaUsage old = before.get(u.getId());
            ConditionalUpdate.Builder b = ConditionalUpdate.on(EntityRegistry.QUOTA_USAGES)
                    .expect("id", u.getId())
                    .expect("in_use", old.getInUse())
                    .expect("reserved", old.getReserved());

            boolean changed = false;
            if (u.getInUse() != old.getInUse()) {
                b.set("in_use", u.getInUse());
                changed = true;
            }
            if (u.getReserved() != old.getReserved()) {
                b.set("reserved", u.getReserved());
                changed = true;
            }
            if (!Objects.equals(u.getUntilRefresh(), old.getUntilRefresh())) {
                b.set("until_refresh", u.getUntilRefresh());
                changed = true;
            }
            if (!changed) continue;

            if (!updater.conditionalUpdate(tx, b.build())) {
                throw new DataIntegrityFaultException("Usage row id=" + u.getId()
                        + " changed while locked (project=" + u.getProjectId() + ", resource=" + u.getResource() + ")");
            }
        }
    }

    @Override
    public Map<String, UsageSnapshot> getUsage(String projectId) {
        Map<String, UsageSnapshot> result = new LinkedHashMap<>();
        for (QuotaUsage u : repo.findUsages(projectId)) {
            result.put(u.getResource(), u.snapshot());
        }
        return result;
    }

    @Override
    public Optional<QuotaUsage> getUsage(String projectId, String resource) {
        return repo.findUsage(projectId, resource).stream().findFirst();
    }

    @Override
    public Optional<Quota> getQuota(String projectId, String resource) {
        return quotaStore.getQuota(projectId, resource);
    }

    private void validate(ReserveRequest request) {
        if (request == null || request.getProjectId() == null || request.getProjectId().isBlank()) {
            throw new ProgrammingErrorException("reserve needs a project id");
        }
        for (String resource : request.getDeltas().keySet()) {
            if (request.getDeltas().get(resource) == null) {
                throw new ProgrammingErrorException("Delta of " + resource + " is null");
            }
            QuotaResource def = request.getResources().get(resource);
            if (def == null) {
                throw new ProgrammingErrorException("Unknown resource " + resource);
            }
            if (!syncRegistry.supports(def.sync())) {
                throw new ProgrammingErrorException("No sync function for resource " + resource);
            }
            if (request.getQuotas().get(resource) == null) {
                throw new ProgrammingErrorException("No quota limit given for resource " + resource);
            }
        }
    }

    private ReserveParams paramsOf(ReserveRequest request) {
        Instant expire = request.getExpire() != null
                ? request.getExpire()
                : clock.instant().plus(props.getReservationExpire());
        int untilRefresh = request.getUntilRefresh() != null ? request.getUntilRefresh() : props.getUntilRefresh();
        Duration maxAge = request.getMaxAge() != null ? request.getMaxAge() : props.getMaxAge();
        return new ReserveParams(expire, untilRefresh > 0 ? untilRefresh : null, maxAge);
    }

    private static Map<Long, QuotaUsage> copyOf(Collection<QuotaUsage> usages) {
        Map<Long, QuotaUsage> copy = new LinkedHashMap<>();
        for (QuotaUsage u : usages) copy.put(u.getId(), u.toBuilder().build());
        return copy;
    }

    private static int orZero(Integer v) {
        return v == null ? 0 : v;
    }

    private static <T> T withMdc(String op, String projectId, Supplier<T> work) {
        LedgerContext previous = LedgerMdc.current();
        LedgerMdc.clear();
        LedgerMdc.put(new LedgerContext(op, projectId));
        try {
            return work.get();
        } finally {
            LedgerMdc.restore(previous);
        }
    }

    @FunctionalInterface
    private interface Resolution {
        void apply(QuotaUsage usage, Reservation reservation);
    }

    /** Request settings after configuration defaults; {@code untilRefresh} null = countdown off. */
    private record ReserveParams(Instant expire, Integer untilRefresh, Duration maxAge) {}
}
