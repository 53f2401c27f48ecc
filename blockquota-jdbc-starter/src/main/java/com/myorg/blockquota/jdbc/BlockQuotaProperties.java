package com.myorg.blockquota.jdbc;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "blockquota")
public class BlockQuotaProperties {

    private boolean enabled = true;

    /** Lifetime of a reservation that is neither committed nor rolled back. */
    private Duration reservationExpire = Duration.ofDays(1);

    /** Reservations between forced usage refreshes; 0 disables the countdown. */
    private int untilRefresh = 0;

    /** Usage older than this is refreshed on the next reservation; zero disables. */
    private Duration maxAge = Duration.ZERO;

    /** Count only volume sizes towards {@code gigabytes}, not snapshot sizes. */
    private boolean noSnapshotGbQuota = false;

    private Retry retry = new Retry();
    private Expirer expirer = new Expirer();
    private Metrics metrics = new Metrics();

    @Data
    public static class Retry {
        private int maxRetries = 5;
        private Duration backoffBase = Duration.ofMillis(500);
        private Duration backoffMax = Duration.ofSeconds(10);
    }

    @Data
    public static class Expirer {
        private boolean enabled = false;
        private boolean schedulingEnabled = true;

        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration initialDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
