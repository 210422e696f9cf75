package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.HeuristicMentionExtractor;
import br.edu.ifba.graphrag.disambiguation.MentionExtractor;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.llm.CompletionFunction;
import br.edu.ifba.graphrag.routing.QueryRouter;
import br.edu.ifba.graphrag.routing.RouteDecision;
import br.edu.ifba.graphrag.routing.RouteProfile;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.synthesis.EvidenceExpander;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import br.edu.ifba.graphrag.trace.Tracer;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Routes a query and runs it, falling back to more general routes.
 *
 * <p>The selected route runs first. When it finds no evidence or fails recoverably, the next
 * more general route that the profile permits and the store can serve runs instead. Tenant
 * violations and an unreachable store abort immediately. The answer names the route that
 * produced it; when no route finds evidence, the insufficient-evidence answer names the
 * selected route.</p>
 */
@ApplicationScoped
public class QueryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final QueryRouter router;
    private final RouteExecutor directVectorLookup;
    private final RouteExecutor localGraphSearch;
    private final RouteExecutor globalSummarySearch;
    private final RouteExecutor multiHopDiscovery;

    @Inject
    public QueryOrchestrator(
            QueryRouter router,
            Synthesizer synthesizer,
            GraphQueryGateway gateway,
            EmbeddingFunction embeddingFunction,
            CompletionFunction completion,
            MentionExtractor extractor,
            Disambiguator disambiguator,
            Tracer tracer,
            ObjectMapper objectMapper) {
        this(router, executors(synthesizer, gateway, embeddingFunction, completion, extractor, disambiguator,
            tracer, objectMapper));
    }

    public QueryOrchestrator(@NotNull QueryRouter router, @NotNull List<RouteExecutor> executors) {
        this.router = router;
        this.directVectorLookup = find(executors, QueryRoute.DIRECT_VECTOR_LOOKUP);
        this.localGraphSearch = find(executors, QueryRoute.LOCAL_GRAPH_SEARCH);
        this.globalSummarySearch = find(executors, QueryRoute.GLOBAL_SUMMARY_SEARCH);
        this.multiHopDiscovery = find(executors, QueryRoute.MULTI_HOP_DISCOVERY);
    }

    static List<RouteExecutor> executors(
            Synthesizer synthesizer, GraphQueryGateway gateway, EmbeddingFunction embeddingFunction,
            CompletionFunction completion, MentionExtractor extractor, Disambiguator disambiguator,
            Tracer tracer, ObjectMapper objectMapper) {
        EvidenceExpander expander = new DisambiguatingEvidenceExpander(disambiguator, new HeuristicMentionExtractor(),
            tracer);
        return List.of(
            new DirectVectorLookupExecutor(synthesizer, gateway, embeddingFunction),
            new LocalGraphSearchExecutor(synthesizer, extractor, disambiguator, tracer, expander),
            new GlobalSummarySearchExecutor(synthesizer, gateway, extractor, disambiguator, tracer, expander),
            new MultiHopDiscoveryExecutor(synthesizer, new QueryDecomposer(completion, objectMapper),
                extractor, disambiguator, tracer, expander));
    }

    /**
     * Routes and answers a query.
     *
     * @param context the query and its parameters
     * @param profile the profile constraining route selection
     */
    public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context, @NotNull RouteProfile profile) {
        RouteDecision decision = router.route(context.query(), profile);
        if (decision.isSubstituted()) {
            logger.info("Route {} replaced by {}: {}", decision.classified(), decision.selected(), decision.reason());
        }
        List<QueryRoute> chain = router.fallbackChain(decision.selected(), profile);
        return attempt(chain, 0, context, false);
    }

    private CompletableFuture<GraphRagAnswer> attempt(
            List<QueryRoute> chain, int index, QueryContext context, boolean degradedSoFar) {
        if (index >= chain.size()) {
            return CompletableFuture.completedFuture(GraphRagAnswer.insufficientEvidence(chain.get(0), degradedSoFar));
        }
        QueryRoute route = chain.get(index);
        RouteExecutor executor = executorFor(route);

        CompletableFuture<GraphRagAnswer> run;
        MDC.put("route", route.wireName());
        try {
            logger.debug("Executing route {}", route);
            run = executor.execute(context);
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        } finally {
            MDC.remove("route");
        }

        return run.handle((answer, error) -> {
                if (error != null) {
                    AsyncCalls.rethrowIfFatal(error);
                    logger.warn("Route {} failed, trying next route: {}", route, AsyncCalls.unwrap(error).getMessage());
                    return null;
                }
                return answer;
            })
            .thenCompose(answer -> {
                if (answer != null && answer.hasEvidence()) {
                    return CompletableFuture.completedFuture(answer);
                }
                boolean degraded = degradedSoFar || (answer != null && answer.degraded());
                if (index + 1 < chain.size()) {
                    logger.info("Route {} found no evidence, falling back to {}", route, chain.get(index + 1));
                }
                return attempt(chain, index + 1, context, degraded);
            });
    }

    @NotNull
    RouteExecutor executorFor(@NotNull QueryRoute route) {
        return switch (route) {
            case DIRECT_VECTOR_LOOKUP -> directVectorLookup;
            case LOCAL_GRAPH_SEARCH -> localGraphSearch;
            case GLOBAL_SUMMARY_SEARCH -> globalSummarySearch;
            case MULTI_HOP_DISCOVERY -> multiHopDiscovery;
        };
    }

    private static RouteExecutor find(List<RouteExecutor> executors, QueryRoute route) {
        return executors.stream()
            .filter(executor -> executor.route() == route)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No executor for route " + route));
    }
}
