package br.edu.ifba.graphrag.adapters;

import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.utils.EmbeddingUtil;
import br.edu.ifba.llm.EmbeddingRequest;
import br.edu.ifba.llm.EmbeddingResponse;
import br.edu.ifba.llm.LlmEmbeddingClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Bridges the {@link LlmEmbeddingClient} REST client to {@link EmbeddingFunction}.
 * A batch is sent as a single request.
 */
@ApplicationScoped
public class QuarkusEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusEmbeddingAdapter.class);

    private final ExecutorService executor = AdapterThreads.newPool("llm-embedding");

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @ConfigProperty(name = "embedding.model")
    String model;

    @Override
    public CompletableFuture<List<float[]>> embedBatch(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            LOG.debugf("Embedding %d text(s) with model %s", Integer.valueOf(texts.size()), model);

            final EmbeddingResponse response = embeddingClient.embed(new EmbeddingRequest(model, texts));
            if (response == null || response.data() == null || response.data().size() != texts.size()) {
                throw new IllegalStateException("Embedding service returned "
                        + (response == null || response.data() == null ? 0 : response.data().size())
                        + " vector(s) for " + texts.size() + " input(s)");
            }

            final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.data());
            ordered.sort(Comparator.comparingInt(e -> e.index() != null ? e.index() : 0));
            final List<float[]> vectors = new ArrayList<>(ordered.size());
            for (EmbeddingResponse.Embedding embedding : ordered) {
                vectors.add(EmbeddingUtil.toFloatArray(embedding.embedding()));
            }
            return vectors;
        }, executor);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
