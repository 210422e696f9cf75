package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Loads the tenant's entity names and embeddings for the scored matchers.
 */
public class EntityCatalog {

    static final int CATALOG_LIMIT = 5000;

    public record Entry(@NotNull String entityId, @NotNull String name, @Nullable float[] embedding) {}

    private final GraphQueryGateway gateway;

    public EntityCatalog(@NotNull GraphQueryGateway gateway) {
        this.gateway = gateway;
    }

    public CompletableFuture<List<Entry>> load(@NotNull QueryParam param) {
        return gateway.query(
                TenantScopedQueryBuilder.forTenant(param.getTenant())
                    .statement(GraphQuery.ENTITY_CATALOG)
                    .param("limit", CATALOG_LIMIT)
                    .build(),
                param.getStoreCallTimeout())
            .thenApply(rows -> {
                List<Entry> entries = new ArrayList<>(rows.size());
                for (GraphRow row : rows) {
                    entries.add(new Entry(row.requireString("entity_id"), row.requireString("name"),
                        row.getEmbedding("embedding")));
                }
                return entries;
            });
    }
}
