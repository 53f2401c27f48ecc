package com.myorg.blockquota.ledger;

import com.myorg.blockquota.contracts.quota.Quota;
import com.myorg.blockquota.contracts.quota.QuotaClass;

import java.util.Map;
import java.util.Optional;

/**
 * Administrative side of the quota tables: project limits, quota classes and whole-project cleanup.
 * Lookups return empty / false when the row is absent so callers can fall back to class defaults.
 */
public interface QuotaStore {

    Quota createQuota(String projectId, String resource, int hardLimit);

    /** @return false when the project has no limit for the resource */
    boolean updateQuota(String projectId, String resource, int hardLimit);

    boolean destroyQuota(String projectId, String resource);

    Optional<Quota> getQuota(String projectId, String resource);

    Map<String, Integer> getAllQuotas(String projectId);

    QuotaClass createQuotaClass(String className, String resource, int hardLimit);

    boolean updateQuotaClass(String className, String resource, int hardLimit);

    Optional<QuotaClass> getQuotaClass(String className, String resource);

    /** Limits of the {@value QuotaClass#DEFAULT_CLASS} class. */
    Map<String, Integer> getQuotaClassDefaults();

    Map<String, Integer> getAllQuotaClasses(String className);

    boolean destroyQuotaClass(String className, String resource);

    int destroyAllQuotaClasses(String className);

    /**
     * Move every limit, class limit and usage of {@code oldResource} to {@code newResource}. Renamed usage
     * rows are forced to refresh on the next reservation.
     */
    void renameResource(String oldResource, String newResource);

    /** Remove the project's limits, keeping usages and reservations. */
    int destroyQuotasByProject(String projectId);

    /** Remove the project's limits, usages and reservations. */
    void destroyAllByProject(String projectId);
}
