package com.myorg.blockquota.jdbc.retry;

import com.myorg.blockquota.contracts.core.exception.StoreRetryExhaustedException;
import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import com.myorg.blockquota.jdbc.QuotaLedgerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs a whole store transaction again when it failed for a transient reason. The work must open its
 * own transaction so that every attempt starts from a clean rollback.
 */
@Slf4j
public class StoreRetry {

    public static final Set<StoreErrorKind> ON_DEADLOCK = EnumSet.of(StoreErrorKind.DEADLOCK);
    public static final Set<StoreErrorKind> ON_DEADLOCK_OR_DUPLICATE =
            EnumSet.of(StoreErrorKind.DEADLOCK, StoreErrorKind.DUPLICATE_KEY);

    private final BlockQuotaProperties.Retry props;
    private final StoreErrorClassifier classifier;
    private final Sleeper sleeper;
    private final QuotaLedgerMetrics metrics; // may be null

    public StoreRetry(BlockQuotaProperties.Retry props, StoreErrorClassifier classifier,
                      Sleeper sleeper, QuotaLedgerMetrics metrics) {
        this.props = props;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public <T> T run(String operation, Set<StoreErrorKind> retryOn, Supplier<T> work) {
        int maxRetries = Math.max(0, props.getMaxRetries());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return work.get();
            } catch (RuntimeException e) {
                StoreErrorKind kind = classifier.classify(e);
                if (!retryOn.contains(kind)) throw e;

                if (attempt > maxRetries) {
                    log.error("Store operation {} gave up after attempts={} lastError={}", operation, attempt, kind.code(), e);
                    throw new StoreRetryExhaustedException(operation, attempt, e);
                }

                Duration wait = backoff(attempt);
                if (metrics != null) metrics.incRetry(kind);
                log.warn("Store operation {} hit {} attempt={} retryIn={}", operation, kind.code(), attempt, wait);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreRetryExhaustedException(operation, attempt, e);
                }
            }
        }
    }

    public void execute(String operation, Set<StoreErrorKind> retryOn, Runnable work) {
        run(operation, retryOn, () -> {
            work.run();
            return null;
        });
    }

    /** retry=1 => base, retry=2 => 2*base, ... capped at backoffMax */
    Duration backoff(int retry) {
        long baseMs = Math.max(1, props.getBackoffBase().toMillis());
        int pow = Math.max(0, retry - 1);
        long exp = 1L << Math.min(30, pow);

        long ms = baseMs * exp;
        ms = Math.min(ms, props.getBackoffMax().toMillis());
        return Duration.ofMillis(ms);
    }
}
