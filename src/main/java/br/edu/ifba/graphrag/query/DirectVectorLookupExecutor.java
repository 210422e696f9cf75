package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.synthesis.EvidenceCollector;
import br.edu.ifba.graphrag.synthesis.SynthesisRequest;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes DIRECT_VECTOR_LOOKUP: nearest chunks to the query embedding, no graph traversal.
 */
public class DirectVectorLookupExecutor extends RouteExecutor {

    private final GraphQueryGateway gateway;
    private final EmbeddingFunction embeddingFunction;

    public DirectVectorLookupExecutor(
            @NotNull Synthesizer synthesizer,
            @NotNull GraphQueryGateway gateway,
            @NotNull EmbeddingFunction embeddingFunction) {
        super(synthesizer);
        this.gateway = gateway;
        this.embeddingFunction = embeddingFunction;
    }

    @Override
    public @NotNull QueryRoute route() {
        return QueryRoute.DIRECT_VECTOR_LOOKUP;
    }

    @Override
    public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context) {
        QueryParam param = context.param();
        return context.queryEmbedding(embeddingFunction)
            .thenCompose(vector -> {
                TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
                    .statement(GraphQuery.CHUNK_VECTOR_SEARCH)
                    .param("embedding", vector)
                    .param("top_k", param.getTopK())
                    .build();
                return gateway.query(statement, param.getStoreCallTimeout());
            })
            .thenCompose(rows -> {
                List<Chunk> chunks = rows.stream().map(EvidenceCollector::toChunk).toList();
                logger.debug("Vector lookup returned {} chunk(s)", chunks.size());
                return synthesizer.synthesize(SynthesisRequest.forChunks(context, route(), chunks));
            });
    }
}
