package br.edu.ifba.graphrag.core;

import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transient state of one query: the query text, its parameters and the memoized query
 * embedding. Created per request and passed explicitly; never shared between queries.
 */
public final class QueryContext {

    private final String query;
    private final QueryParam param;
    private final AtomicReference<CompletableFuture<float[]>> queryEmbedding;

    public QueryContext(@NotNull String query, @NotNull QueryParam param) {
        this(query, param, new AtomicReference<>());
    }

    private QueryContext(String query, QueryParam param, AtomicReference<CompletableFuture<float[]>> queryEmbedding) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.param = Objects.requireNonNull(param, "param must not be null");
        this.queryEmbedding = queryEmbedding;
    }

    @NotNull
    public String query() {
        return query;
    }

    @NotNull
    public QueryParam param() {
        return param;
    }

    @NotNull
    public TenantId tenant() {
        return param.getTenant();
    }

    /**
     * Same query, different text; used for sub-questions. The embedding is not shared.
     */
    @NotNull
    public QueryContext forSubQuestion(@NotNull String subQuestion) {
        return new QueryContext(subQuestion, param);
    }

    /**
     * Same query text with different parameters. The memoized embedding is shared.
     */
    @NotNull
    public QueryContext withParam(@NotNull QueryParam other) {
        return new QueryContext(query, other, queryEmbedding);
    }

    /**
     * Embeds the query text once; later calls return the same future.
     */
    @NotNull
    public CompletableFuture<float[]> queryEmbedding(@NotNull EmbeddingFunction embeddingFunction) {
        CompletableFuture<float[]> existing = queryEmbedding.get();
        if (existing != null) {
            return existing;
        }
        CompletableFuture<float[]> created = new CompletableFuture<>();
        if (!queryEmbedding.compareAndSet(null, created)) {
            return queryEmbedding.get();
        }
        AsyncCalls.withTimeout(embeddingFunction.embed(query), param.getEmbeddingCallTimeout(), "query embedding")
            .whenComplete((vector, error) -> {
                if (error != null) {
                    created.completeExceptionally(AsyncCalls.unwrap(error));
                } else {
                    created.complete(vector);
                }
            });
        return created;
    }
}
