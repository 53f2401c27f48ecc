package com.myorg.blockquota.jdbc.retry;

import com.myorg.blockquota.contracts.core.exception.DataIntegrityFaultException;
import com.myorg.blockquota.contracts.core.exception.StoreRetryExhaustedException;
import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import com.myorg.blockquota.jdbc.QuotaLedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DeadlockLoserDataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StoreRetryTest {

    private final BlockQuotaProperties.Retry props = new BlockQuotaProperties.Retry();
    private final List<Duration> sleeps = new ArrayList<>();
    private final StoreRetry retry = new StoreRetry(props, new DefaultStoreErrorClassifier(), sleeps::add, null);

    @Test
    void deadlock_isRetriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.run("op", StoreRetry.ON_DEADLOCK, () -> {
            if (calls.incrementAndGet() < 3) throw new DeadlockLoserDataAccessException("deadlock", null);
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
    }

    @Test
    void duplicateKey_isOnlyRetriedWhenAsked() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(DuplicateKeyException.class, () -> retry.run("op", StoreRetry.ON_DEADLOCK, () -> {
            calls.incrementAndGet();
            throw new DuplicateKeyException("dup");
        }));
        assertEquals(1, calls.get());

        calls.set(0);
        retry.execute("op", StoreRetry.ON_DEADLOCK_OR_DUPLICATE, () -> {
            if (calls.incrementAndGet() == 1) throw new DuplicateKeyException("dup");
        });
        assertEquals(2, calls.get());
    }

    @Test
    void nonRetryable_isRethrownAtOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(DataIntegrityFaultException.class, () -> retry.run("op", StoreRetry.ON_DEADLOCK_OR_DUPLICATE, () -> {
            calls.incrementAndGet();
            throw new DataIntegrityFaultException("broken");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void exhaustion_carriesAttemptsAndCause() {
        props.setMaxRetries(5);
        AtomicInteger calls = new AtomicInteger();

        StoreRetryExhaustedException ex = assertThrows(StoreRetryExhaustedException.class,
                () -> retry.run("reserve", StoreRetry.ON_DEADLOCK, () -> {
                    calls.incrementAndGet();
                    throw new DeadlockLoserDataAccessException("deadlock", null);
                }));

        assertEquals(6, calls.get());
        assertEquals(6, ex.getAttempts());
        assertEquals("RETRY_EXHAUSTED", ex.getReason());
        assertInstanceOf(DeadlockLoserDataAccessException.class, ex.getCause());
    }

    @Test
    void backoff_doublesAndIsCapped() {
        props.setBackoffBase(Duration.ofMillis(500));
        props.setBackoffMax(Duration.ofSeconds(3));

        assertEquals(Duration.ofMillis(500), retry.backoff(1));
        assertEquals(Duration.ofMillis(1000), retry.backoff(2));
        assertEquals(Duration.ofMillis(2000), retry.backoff(3));
        assertEquals(Duration.ofMillis(3000), retry.backoff(4));
        assertEquals(Duration.ofMillis(3000), retry.backoff(40));
    }

    @Test
    void retries_areCountedByKind() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        QuotaLedgerMetrics metrics = new QuotaLedgerMetrics(registry, null);
        StoreRetry counted = new StoreRetry(props, new DefaultStoreErrorClassifier(), d -> {}, metrics);
        AtomicInteger calls = new AtomicInteger();

        counted.run("op", StoreRetry.ON_DEADLOCK_OR_DUPLICATE, () -> {
            int n = calls.incrementAndGet();
            if (n == 1) throw new DuplicateKeyException("dup");
            if (n == 2) throw new DeadlockLoserDataAccessException("deadlock", null);
            return n;
        });

        assertEquals(1.0, registry.counter("blockquota.store.retries", "kind", "DUPLICATE_KEY").count());
        assertEquals(1.0, registry.counter("blockquota.store.retries", "kind", "DEADLOCK").count());
    }
}
