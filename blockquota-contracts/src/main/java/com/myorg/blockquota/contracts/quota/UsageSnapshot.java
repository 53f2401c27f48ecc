package com.myorg.blockquota.contracts.quota;

public record UsageSnapshot(int inUse, int reserved) {}
