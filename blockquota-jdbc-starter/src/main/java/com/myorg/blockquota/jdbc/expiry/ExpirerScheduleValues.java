package com.myorg.blockquota.jdbc.expiry;

import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ExpirerScheduleValues {
    private final BlockQuotaProperties props;

    public long getPollIntervalMs() { return props.getExpirer().getPollInterval().toMillis(); }
    public long getInitialDelayMs() { return props.getExpirer().getInitialDelay().toMillis(); }
}
