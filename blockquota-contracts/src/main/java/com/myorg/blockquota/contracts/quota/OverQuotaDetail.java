package com.myorg.blockquota.contracts.quota;

import java.util.List;
import java.util.Map;

/**
 * Why a reservation was refused.
 *
 * @param overs  resources that would exceed their limit, sorted
 * @param quotas the limits the request was checked against
 * @param usages usage of every requested resource at decision time
 */
public record OverQuotaDetail(
        List<String> overs,
        Map<String, Integer> quotas,
        Map<String, UsageSnapshot> usages
) {
    public OverQuotaDetail {
        overs = List.copyOf(overs);
        quotas = Map.copyOf(quotas);
        usages = Map.copyOf(usages);
    }
}
