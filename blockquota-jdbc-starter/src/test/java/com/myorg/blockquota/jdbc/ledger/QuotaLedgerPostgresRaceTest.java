package com.myorg.blockquota.jdbc.ledger;

import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.contracts.quota.ReserveRequest;
import com.myorg.blockquota.contracts.quota.ReserveResult;
import com.myorg.blockquota.contracts.quota.SyncKind;
import com.myorg.blockquota.contracts.quota.UsageSnapshot;
import com.myorg.blockquota.jdbc.LedgerFixture;
import com.myorg.blockquota.ledger.update.ConditionalUpdate;
import com.myorg.blockquota.ledger.update.EntityRegistry;
import com.myorg.blockquota.ledger.update.UpdateValue;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races real transactions against each other. Needs Docker; skipped without it.
 */
@Testcontainers(disabledWithoutDocker = true)
class QuotaLedgerPostgresRaceTest {

    static final int THREADS = 8;
    static final QuotaResource VOLUMES = QuotaResource.of("volumes", SyncKind.VOLUMES);

    @Container
    static final PostgreSQLContainer<?> pg = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("blockquota_it")
            .withUsername("test")
            .withPassword("test");

    static HikariDataSource ds;

    private LedgerFixture f;
    private JdbcQuotaLedger ledger;
    private String project;

    @BeforeAll
    static void dataSource() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(pg.getJdbcUrl());
        cfg.setUsername(pg.getUsername());
        cfg.setPassword(pg.getPassword());
        cfg.setMaximumPoolSize(THREADS * 2);
        ds = new HikariDataSource(cfg);
    }

    @AfterAll
    static void close() {
        if (ds != null) ds.close();
    }

    @BeforeEach
    void setUp() {
        f = new LedgerFixture(ds, "classpath:db/migration/postgresql");
        f.props.getRetry().setMaxRetries(20);
        ledger = f.ledger();
        project = "p-" + UUID.randomUUID();
    }

    private ReserveRequest.ReserveRequestBuilder volumes(int delta, int limit) {
        return ReserveRequest.builder()
                .projectId(project)
                .resources(Map.of("volumes", VOLUMES))
                .quotas(Map.of("volumes", limit))
                .deltas(Map.of("volumes", delta));
    }

    private static <T> List<T> race(int tasks, Callable<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> fu : futures) results.add(fu.get(60, TimeUnit.SECONDS));
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentFirstReserves_createOneUsageRow() throws Exception {
        List<ReserveResult> results = race(THREADS, () -> ledger.reserve(volumes(1, 100).build()));

        assertTrue(results.stream().allMatch(ReserveResult::isReserved));
        assertEquals(1, f.repo.findUsage(project, "volumes").size());
        assertEquals(new UsageSnapshot(0, THREADS), ledger.getUsage(project).get("volumes"));
    }

    @Test
    void concurrentReserves_neverExceedLimit() throws Exception {
        int limit = 25;
        ledger.reserve(volumes(0, limit).build());

        List<ReserveResult> results = race(60, () -> ledger.reserve(volumes(1, limit).build()));

        long admitted = results.stream().filter(ReserveResult::isReserved).count();
        assertEquals(limit, admitted);
        assertEquals(new UsageSnapshot(0, limit), ledger.getUsage(project).get("volumes"));
        assertEquals(limit + 1, f.repo.findReservations(project).size());
    }

    @Test
    void commitsRacingExpiry_leaveConsistentUsage() throws Exception {
        Instant soon = LedgerFixture.T0.plus(Duration.ofMinutes(1));
        List<List<String>> toCommit = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < 10; i++) {
            toCommit.add(ledger.reserve(volumes(2, 100).build()).reservations());
            ledger.reserve(volumes(3, 100).expire(soon).build());
        }
        assertEquals(new UsageSnapshot(0, 50), ledger.getUsage(project).get("volumes"));

        AtomicInteger next = new AtomicInteger();
        Instant later = LedgerFixture.T0.plus(Duration.ofHours(1));
        race(20, () -> {
            int i = next.getAndIncrement();
            if (i % 2 == 0) ledger.commit(toCommit.get(i / 2), project);
            else ledger.expire(later);
            return null;
        });

        assertEquals(new UsageSnapshot(20, 0), ledger.getUsage(project).get("volumes"));
        assertTrue(f.repo.findReservations(project).isEmpty());
    }

    @Test
    void conditionalUpdate_hasExactlyOneWinner() throws Exception {
        String volumeId = UUID.randomUUID().toString();
        f.insertVolume(volumeId, project, 10, null);
        ConditionalUpdate retype = ConditionalUpdate.on(EntityRegistry.VOLUMES)
                .set("status", "retyping")
                .set("previous_status", UpdateValue.field("status"))
                .expect("id", volumeId)
                .expect("status", "available")
                .build();

        List<Boolean> results = race(THREADS, () -> f.updater.conditionalUpdate(retype));

        assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
        assertEquals("available", f.jdbc.queryForObject(
                "SELECT previous_status FROM volumes WHERE id = ?", String.class, volumeId));
    }
}
