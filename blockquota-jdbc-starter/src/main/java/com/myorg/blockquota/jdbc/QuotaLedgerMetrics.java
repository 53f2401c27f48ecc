package com.myorg.blockquota.jdbc;

import com.myorg.blockquota.jdbc.ledger.JdbcQuotaRepository;
import com.myorg.blockquota.jdbc.retry.StoreErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class QuotaLedgerMetrics {

    private final MeterRegistry registry;
    private final JdbcQuotaRepository repo;

    private Counter created;
    private Counter committed;
    private Counter rolledBack;
    private Counter expired;
    private Counter overQuota;

    public void preRegister() {
        created = Counter.builder("blockquota.reservations.created").register(registry);
        committed = Counter.builder("blockquota.reservations.committed").register(registry);
        rolledBack = Counter.builder("blockquota.reservations.rolledback").register(registry);
        expired = Counter.builder("blockquota.reservations.expired").register(registry);
        overQuota = Counter.builder("blockquota.overquota").register(registry);

        registry.gauge("blockquota.reservations.outstanding", repo, JdbcQuotaRepository::countReservations);
    }

    public void incCreated(int n) { if (created != null) created.increment(n); }
    public void incCommitted(int n) { if (committed != null) committed.increment(n); }
    public void incRolledBack(int n) { if (rolledBack != null) rolledBack.increment(n); }
    public void incExpired(int n) { if (expired != null) expired.increment(n); }
    public void incOverQuota() { if (overQuota != null) overQuota.increment(); }

    public void incRetry(StoreErrorKind kind) {
        registry.counter("blockquota.store.retries", "kind", kind.code()).increment();
    }
}
