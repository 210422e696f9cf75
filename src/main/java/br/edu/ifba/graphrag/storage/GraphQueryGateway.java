package br.edu.ifba.graphrag.storage;

import br.edu.ifba.exception.BackendDegradedException;
import br.edu.ifba.exception.TenantIsolationViolationException;
import br.edu.ifba.graphrag.core.TenantId;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point from the query pipeline to the {@link KnowledgeGraphStore}.
 *
 * <p>Each call is bounded by a timeout, rejected up front when the store lacks the
 * statement's capability, and every returned row is checked against the requesting
 * tenant. A foreign row fails the call with {@link TenantIsolationViolationException}
 * and is logged on the {@code SECURITY} logger.</p>
 */
@ApplicationScoped
public class GraphQueryGateway {

    private static final Logger logger = LoggerFactory.getLogger(GraphQueryGateway.class);
    private static final Logger SECURITY = LoggerFactory.getLogger("SECURITY");

    private final KnowledgeGraphStore store;

    @Inject
    public GraphQueryGateway(KnowledgeGraphStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @NotNull
    public Set<GraphCapability> capabilities() {
        return store.capabilities();
    }

    public boolean supports(@NotNull GraphCapability capability) {
        return store.supports(capability);
    }

    /**
     * Runs a statement with a timeout and tenant verification.
     *
     * @param statement the tenant-scoped statement
     * @param timeout   per-call timeout
     * @return verified rows
     */
    public CompletableFuture<List<GraphRow>> query(@NotNull TenantScopedStatement statement, @NotNull Duration timeout) {
        GraphCapability required = statement.query().requiredCapability();
        if (required != null && !store.supports(required)) {
            return CompletableFuture.failedFuture(new BackendDegradedException(
                "Store lacks " + required + " required by " + statement.query()));
        }

        logger.debug("Executing {} for tenant {}", statement.query(), statement.tenant());
        CompletableFuture<List<GraphRow>> call;
        try {
            call = store.query(statement);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return AsyncCalls.withTimeout(call, timeout, "graph store " + statement.query())
            .thenApply(rows -> verifyTenant(statement, rows));
    }

    private List<GraphRow> verifyTenant(TenantScopedStatement statement, List<GraphRow> rows) {
        TenantId tenant = statement.tenant();
        for (GraphRow row : rows) {
            String found = row.groupId();
            if (!tenant.value().equals(found)) {
                SECURITY.error("Tenant isolation violation: statement={} requestedTenant={} rowTenant={}",
                    statement.query(), tenant, found);
                throw new TenantIsolationViolationException(
                    tenant.value(), String.valueOf(found), statement.query().name());
            }
        }
        return rows;
    }
}
