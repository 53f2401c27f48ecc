package com.myorg.blockquota.contracts.quota;

import lombok.*;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {
    private long id;
    private String projectId;
    private String resource;
    private int inUse;
    private int reserved;
    private Integer untilRefresh; // null = countdown disabled
    private Instant createdAt;
    private Instant updatedAt;

    public long total() {
        return (long) inUse + reserved;
    }

    public UsageSnapshot snapshot() {
        return new UsageSnapshot(inUse, reserved);
    }
}
