package com.myorg.blockquota.ledger.observability;

public record LedgerContext(
        String operation,
        String projectId
) {}
