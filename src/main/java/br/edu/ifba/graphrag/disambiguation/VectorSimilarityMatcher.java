package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import br.edu.ifba.graphrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding similarity between mentions and entities. Uses the store's vector index when
 * available and otherwise compares against the embeddings in the entity catalog.
 */
public class VectorSimilarityMatcher implements EntityMatcher {

    static final double MIN_SIMILARITY = 0.75;

    private final GraphQueryGateway gateway;
    private final EntityCatalog catalog;
    private final EmbeddingFunction embeddingFunction;

    public VectorSimilarityMatcher(
            @NotNull GraphQueryGateway gateway,
            @NotNull EntityCatalog catalog,
            @NotNull EmbeddingFunction embeddingFunction) {
        this.gateway = gateway;
        this.catalog = catalog;
        this.embeddingFunction = embeddingFunction;
    }

    @Override
    @NotNull
    public MatchStrategy strategy() {
        return MatchStrategy.VECTOR_SIMILARITY;
    }

    @Override
    public CompletableFuture<Map<String, List<MatchCandidate>>> match(@NotNull List<String> mentions, @NotNull QueryParam param) {
        return AsyncCalls.withTimeout(embeddingFunction.embedBatch(mentions), param.getEmbeddingCallTimeout(), "mention embedding")
            .thenCompose(vectors -> gateway.supports(GraphCapability.VECTOR_INDEX)
                ? viaIndex(mentions, vectors, param)
                : viaCatalog(mentions, vectors, param));
    }

    private CompletableFuture<Map<String, List<MatchCandidate>>> viaIndex(
            List<String> mentions, List<float[]> vectors, QueryParam param) {
        List<CompletableFuture<List<GraphRow>>> searches = new ArrayList<>();
        for (float[] vector : vectors) {
            searches.add(gateway.query(
                TenantScopedQueryBuilder.forTenant(param.getTenant())
                    .statement(GraphQuery.ENTITY_VECTOR_SEARCH)
                    .param("embedding", vector)
                    .param("top_k", param.getMaxCandidatesPerMention())
                    .build(),
                param.getStoreCallTimeout()));
        }
        return CompletableFuture.allOf(searches.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            Map<String, List<MatchCandidate>> result = new HashMap<>();
            for (int i = 0; i < mentions.size(); i++) {
                List<MatchCandidate> candidates = new ArrayList<>();
                for (GraphRow row : searches.get(i).join()) {
                    double similarity = row.getDouble("score", 0.0);
                    if (similarity > MIN_SIMILARITY) {
                        String name = row.requireString("name");
                        candidates.add(new MatchCandidate(row.requireString("entity_id"), name, name, similarity));
                    }
                }
                if (!candidates.isEmpty()) {
                    result.put(mentions.get(i), candidates);
                }
            }
            return result;
        });
    }

    private CompletableFuture<Map<String, List<MatchCandidate>>> viaCatalog(
            List<String> mentions, List<float[]> vectors, QueryParam param) {
        return catalog.load(param).thenApply(entries -> {
            Map<String, List<MatchCandidate>> result = new HashMap<>();
            for (int i = 0; i < mentions.size(); i++) {
                List<MatchCandidate> candidates = new ArrayList<>();
                for (EntityCatalog.Entry entry : entries) {
                    double similarity = EmbeddingUtil.similarityOrZero(vectors.get(i), entry.embedding());
                    if (similarity > MIN_SIMILARITY) {
                        candidates.add(new MatchCandidate(entry.entityId(), entry.name(), entry.name(), similarity));
                    }
                }
                if (!candidates.isEmpty()) {
                    result.put(mentions.get(i), candidates);
                }
            }
            return result;
        });
    }
}
