package com.myorg.blockquota.contracts.quota;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaClass {
    public static final String DEFAULT_CLASS = "default";

    private long id;
    private String className;
    private String resource;
    private int hardLimit;
}
