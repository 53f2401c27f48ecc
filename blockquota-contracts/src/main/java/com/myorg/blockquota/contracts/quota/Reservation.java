package com.myorg.blockquota.contracts.quota;

import lombok.*;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {
    private long id;
    private String uuid;
    private long usageId;
    private String projectId;
    private String resource;
    private int delta;
    private Instant expire;
    private Instant createdAt;
}
