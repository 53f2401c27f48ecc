package com.myorg.blockquota.contracts.quota;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Quota {
    private long id;
    private String projectId;
    private String resource;
    private int hardLimit; // negative = unlimited
}
