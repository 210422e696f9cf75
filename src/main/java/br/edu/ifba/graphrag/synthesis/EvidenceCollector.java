package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the chunks mentioning a set of entities in one store call and removes duplicates.
 */
public class EvidenceCollector {

    private final GraphQueryGateway gateway;

    public EvidenceCollector(@NotNull GraphQueryGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Chunks for the given entities in rank order, at most {@code limitPerEntity} per entity,
     * deduplicated.
     */
    public CompletableFuture<List<Chunk>> collect(@NotNull List<RankedEntity> entities, @NotNull QueryParam param) {
        if (entities.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<String> entityIds = entities.stream().map(RankedEntity::entityId).distinct().toList();
        TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
            .statement(GraphQuery.CHUNKS_FOR_ENTITIES)
            .param("entity_ids", entityIds)
            .param("limit_per_entity", param.getLimitPerEntity())
            .build();
        return gateway.query(statement, param.getStoreCallTimeout())
            .thenApply(rows -> deduplicate(orderByEntityRank(rows.stream().map(EvidenceCollector::toChunk).toList(),
                entityIds)));
    }

    /**
     * Maps a chunk row as returned by {@code CHUNKS_FOR_ENTITIES} or {@code CHUNK_VECTOR_SEARCH}.
     */
    @NotNull
    public static Chunk toChunk(@NotNull GraphRow row) {
        String source = row.getString("source");
        String entityId = row.getString("entity_id");
        return new Chunk(
            row.requireString("chunk_id"),
            row.requireString("text"),
            source != null ? source : "unknown",
            row.getString("section_title"),
            row.getStringList("section_path"),
            entityId != null ? Set.of(entityId) : Set.of());
    }

    /**
     * Drops repeated chunk ids and chunks whose normalized text equals an earlier chunk.
     * The first occurrence keeps its place and is credited with the entities of the dropped
     * duplicates. Applying it twice gives the same list.
     */
    @NotNull
    public static List<Chunk> deduplicate(@NotNull List<Chunk> chunks) {
        Map<String, Integer> byId = new HashMap<>();
        Map<String, Integer> byText = new HashMap<>();
        List<Chunk> result = new ArrayList<>();
        for (Chunk chunk : chunks) {
            String text = TextNormalizer.normalize(chunk.text());
            Integer kept = byId.get(chunk.id());
            if (kept == null) {
                kept = byText.get(text);
            }
            if (kept != null) {
                result.set(kept, result.get(kept).withEntityIds(chunk.entityIds()));
                byId.putIfAbsent(chunk.id(), kept);
                continue;
            }
            byId.put(chunk.id(), result.size());
            byText.put(text, result.size());
            result.add(chunk);
        }
        return result;
    }

    private static List<Chunk> orderByEntityRank(List<Chunk> chunks, List<String> entityIds) {
        List<Chunk> ordered = new ArrayList<>(chunks.size());
        for (String entityId : entityIds) {
            for (Chunk chunk : chunks) {
                if (chunk.entityIds().contains(entityId)) {
                    ordered.add(chunk);
                }
            }
        }
        for (Chunk chunk : chunks) {
            if (chunk.entityIds().stream().noneMatch(entityIds::contains)) {
                ordered.add(chunk);
            }
        }
        return ordered;
    }
}
