package br.edu.ifba.graphrag.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding model used for query vectors, vector disambiguation and beam scoring.
 */
public interface EmbeddingFunction {

    /**
     * Embeds several texts in one call. The result has one vector per input, in input order.
     */
    CompletableFuture<List<float[]>> embedBatch(@NotNull List<String> texts);

    default CompletableFuture<float[]> embed(@NotNull String text) {
        return embedBatch(List.of(text)).thenApply(vectors -> {
            if (vectors.isEmpty()) {
                throw new IllegalStateException("Embedding service returned no vector");
            }
            return vectors.get(0);
        });
    }
}
