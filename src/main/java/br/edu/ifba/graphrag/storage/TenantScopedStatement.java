package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.TenantId;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.UUID;

/**
 * A statement bound to one tenant. Instances are only created by
 * {@link TenantScopedQueryBuilder}, which always injects the {@code group_id} parameter.
 */
public final class TenantScopedStatement {

    public static final String GROUP_ID = "group_id";

    private final String id;
    private final GraphQuery query;
    private final TenantId tenant;
    private final Map<String, Object> params;

    TenantScopedStatement(GraphQuery query, TenantId tenant, Map<String, Object> params) {
        this.id = UUID.randomUUID().toString();
        this.query = query;
        this.tenant = tenant;
        this.params = Map.copyOf(params);
    }

    /**
     * Unique id of this statement instance, stable across retries of the same call.
     */
    @NotNull
    public String id() {
        return id;
    }

    @NotNull
    public GraphQuery query() {
        return query;
    }

    @NotNull
    public TenantId tenant() {
        return tenant;
    }

    /**
     * Immutable parameters, including {@code group_id}.
     */
    @NotNull
    public Map<String, Object> params() {
        return params;
    }

    @SuppressWarnings("unchecked")
    public <T> T param(@NotNull String name) {
        return (T) params.get(name);
    }

    @Override
    public String toString() {
        return query + "[tenant=" + tenant + "]";
    }
}
