package br.edu.ifba.graphrag.storage;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only access to the multi-tenant knowledge graph.
 *
 * <p>The query pipeline never talks to an implementation directly; it goes through
 * {@link GraphQueryGateway}, which applies timeouts, capability checks and tenant
 * verification of every returned row.</p>
 *
 * <p>Implementations must fail the returned future with
 * {@link br.edu.ifba.exception.KnowledgeGraphUnavailableException} when the backend cannot
 * be reached, and with {@link br.edu.ifba.exception.BackendDegradedException} when asked to
 * run a statement whose required capability they lack.</p>
 */
public interface KnowledgeGraphStore {

    /**
     * Executes a tenant-scoped statement.
     *
     * @param statement statement built by {@link TenantScopedQueryBuilder}
     * @return rows, each carrying a {@code group_id} column
     */
    CompletableFuture<List<GraphRow>> query(@NotNull TenantScopedStatement statement);

    /**
     * Capabilities this store offers.
     */
    @NotNull
    Set<GraphCapability> capabilities();

    default boolean supports(@NotNull GraphCapability capability) {
        return capabilities().contains(capability);
    }
}
