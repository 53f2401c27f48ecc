package com.myorg.blockquota.jdbc.expiry;

import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import com.myorg.blockquota.ledger.QuotaLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;

/**
 * Periodically releases reservations whose expiry has passed, for callers that never commit
 * or roll back.
 */
@Slf4j
@RequiredArgsConstructor
public class ReservationExpirer {

    private final BlockQuotaProperties props;
    private final QuotaLedger ledger;
    private final Clock clock;

    @Scheduled(
            initialDelayString = "#{@blockQuotaExpirerSchedule.initialDelayMs}",
            fixedDelayString = "#{@blockQuotaExpirerSchedule.pollIntervalMs}"
    )
    public void scheduledLoop() {
        if (!props.getExpirer().isEnabled()) return;
        if (!props.getExpirer().isSchedulingEnabled()) return;
        try {
            runOnce();
        } catch (RuntimeException e) {
            // keep the schedule alive, next tick retries
            log.error("Reservation expiry sweep failed", e);
        }
    }

    public int runOnce() {
        if (!props.getExpirer().isEnabled()) return 0;
        return ledger.expire(clock.instant());
    }
}
