package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.MentionExtractor;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.synthesis.EvidenceExpander;
import br.edu.ifba.graphrag.synthesis.SynthesisRequest;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import br.edu.ifba.graphrag.trace.TraceMode;
import br.edu.ifba.graphrag.trace.Tracer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes GLOBAL_SUMMARY_SEARCH.
 *
 * <p>Seeds are the entities named in the query, if any, followed by the tenant's best
 * connected hub entities. Personalized ranking around those seeds selects the entities whose
 * chunks are summarized.</p>
 */
public class GlobalSummarySearchExecutor extends RouteExecutor {

    static final double HUB_SEED_SCORE = 0.5;

    private final GraphQueryGateway gateway;
    private final MentionExtractor extractor;
    private final Disambiguator disambiguator;
    private final Tracer tracer;
    private final EvidenceExpander expander;

    public GlobalSummarySearchExecutor(
            @NotNull Synthesizer synthesizer,
            @NotNull GraphQueryGateway gateway,
            @NotNull MentionExtractor extractor,
            @NotNull Disambiguator disambiguator,
            @NotNull Tracer tracer,
            @NotNull EvidenceExpander expander) {
        super(synthesizer);
        this.gateway = gateway;
        this.extractor = extractor;
        this.disambiguator = disambiguator;
        this.tracer = tracer;
        this.expander = expander;
    }

    @Override
    public @NotNull QueryRoute route() {
        return QueryRoute.GLOBAL_SUMMARY_SEARCH;
    }

    @Override
    public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context) {
        CompletableFuture<List<RankedEntity>> named = resolveSeeds(context.query(), context, extractor, disambiguator);
        CompletableFuture<List<RankedEntity>> hubs = hubEntities(context.param());

        return named.thenCombine(hubs, GlobalSummarySearchExecutor::mergeSeeds)
            .thenCompose(seeds -> {
                logger.debug("Global search seeded with {} entity(ies)", seeds.size());
                return tracer.expand(seeds, TraceMode.APPROXIMATE_RANK, context);
            })
            .thenCompose(trace -> synthesizer.synthesize(
                SynthesisRequest.forTrace(context, route(), trace).withExpander(expander)));
    }

    private CompletableFuture<List<RankedEntity>> hubEntities(QueryParam param) {
        TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
            .statement(GraphQuery.HUB_ENTITIES)
            .param("top_k", param.getTopK())
            .build();
        return gateway.query(statement, param.getStoreCallTimeout())
            .thenApply(rows -> rows.stream()
                .filter(row -> row.getInt("degree", 0) > 0)
                .map(row -> new RankedEntity(row.requireString("entity_id"),
                    row.getString("name") != null ? row.getString("name") : row.requireString("entity_id"),
                    HUB_SEED_SCORE))
                .toList());
    }

    static List<RankedEntity> mergeSeeds(List<RankedEntity> named, List<RankedEntity> hubs) {
        Map<String, RankedEntity> merged = new LinkedHashMap<>();
        named.forEach(entity -> merged.putIfAbsent(entity.entityId(), entity));
        hubs.forEach(entity -> merged.putIfAbsent(entity.entityId(), entity));
        return new ArrayList<>(merged.values());
    }
}
