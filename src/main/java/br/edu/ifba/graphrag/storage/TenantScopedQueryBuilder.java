package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.TenantId;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The only way to construct a {@link TenantScopedStatement}.
 *
 * <pre>{@code
 * TenantScopedStatement stmt = TenantScopedQueryBuilder.forTenant(tenant)
 *     .statement(GraphQuery.NEIGHBORS_BATCH)
 *     .param("entity_ids", ids)
 *     .param("limit_per_node", 25)
 *     .build();
 * }</pre>
 */
public final class TenantScopedQueryBuilder {

    private final TenantId tenant;
    private final Map<String, Object> params = new HashMap<>();
    private GraphQuery query;

    private TenantScopedQueryBuilder(TenantId tenant) {
        this.tenant = tenant;
    }

    public static TenantScopedQueryBuilder forTenant(@NotNull TenantId tenant) {
        return new TenantScopedQueryBuilder(Objects.requireNonNull(tenant, "tenant must not be null"));
    }

    public TenantScopedQueryBuilder statement(@NotNull GraphQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        return this;
    }

    /**
     * Adds a parameter. Collections are copied; {@code group_id} cannot be set by callers.
     */
    public TenantScopedQueryBuilder param(@NotNull String name, @NotNull Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value of " + name + " must not be null");
        if (TenantScopedStatement.GROUP_ID.equals(name)) {
            throw new IllegalArgumentException("group_id is injected from the tenant and cannot be overridden");
        }
        params.put(name, value instanceof Collection<?> c ? List.copyOf(new ArrayList<>(c)) : value);
        return this;
    }

    public TenantScopedStatement build() {
        if (query == null) {
            throw new IllegalStateException("statement is required");
        }
        for (String required : query.requiredParams()) {
            if (!params.containsKey(required)) {
                throw new IllegalStateException("Missing parameter '" + required + "' for " + query);
            }
        }
        Map<String, Object> bound = new HashMap<>(params);
        bound.put(TenantScopedStatement.GROUP_ID, tenant.value());
        return new TenantScopedStatement(query, tenant, bound);
    }
}
