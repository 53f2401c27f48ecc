package com.myorg.blockquota.ledger.sync;

import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;
import com.myorg.blockquota.contracts.quota.QuotaResource;
import com.myorg.blockquota.contracts.quota.SyncKind;
import com.myorg.blockquota.ledger.LedgerTx;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed dispatch table from {@link SyncKind} to its computation, built once at startup.
 */
public final class ResourceSyncRegistry {

    private final Map<SyncKind, ResourceSyncFunction> functions;

    private ResourceSyncRegistry(Map<SyncKind, ResourceSyncFunction> functions) {
        this.functions = Collections.unmodifiableMap(new EnumMap<>(functions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int sync(LedgerTx tx, String projectId, QuotaResource resource) {
        ResourceSyncFunction fn = functions.get(resource.sync());
        if (fn == null) {
            throw new ProgrammingErrorException("No sync function registered for kind=" + resource.sync()
                    + ", resource=" + resource.name());
        }
        return fn.sync(tx, projectId, resource);
    }

    public boolean supports(SyncKind kind) {
        return functions.containsKey(kind);
    }

    public static final class Builder {
        private final Map<SyncKind, ResourceSyncFunction> functions = new EnumMap<>(SyncKind.class);

        public Builder register(SyncKind kind, ResourceSyncFunction fn) {
            functions.put(kind, fn);
            return this;
        }

        public ResourceSyncRegistry build() {
            return new ResourceSyncRegistry(functions);
        }
    }
}
