package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.MentionExtractor;
import br.edu.ifba.graphrag.synthesis.EvidenceExpander;
import br.edu.ifba.graphrag.synthesis.SynthesisRequest;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import br.edu.ifba.graphrag.trace.TraceMode;
import br.edu.ifba.graphrag.trace.TraceQuality;
import br.edu.ifba.graphrag.trace.TraceResult;
import br.edu.ifba.graphrag.trace.Tracer;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes MULTI_HOP_DISCOVERY.
 *
 * <p>The query is decomposed into sub-questions. Each sub-question is resolved and traced
 * concurrently, bounded by the query deadline; a branch that fails or times out contributes
 * nothing. Branch results are merged by keeping the best score per entity, and one answer is
 * synthesized with the sub-questions as coverage requirements.</p>
 */
public class MultiHopDiscoveryExecutor extends RouteExecutor {

    private final QueryDecomposer decomposer;
    private final MentionExtractor extractor;
    private final Disambiguator disambiguator;
    private final Tracer tracer;
    private final EvidenceExpander expander;

    public MultiHopDiscoveryExecutor(
            @NotNull Synthesizer synthesizer,
            @NotNull QueryDecomposer decomposer,
            @NotNull MentionExtractor extractor,
            @NotNull Disambiguator disambiguator,
            @NotNull Tracer tracer,
            @NotNull EvidenceExpander expander) {
        super(synthesizer);
        this.decomposer = decomposer;
        this.extractor = extractor;
        this.disambiguator = disambiguator;
        this.tracer = tracer;
        this.expander = expander;
    }

    @Override
    public @NotNull QueryRoute route() {
        return QueryRoute.MULTI_HOP_DISCOVERY;
    }

    @Override
    public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context) {
        return decomposer.decompose(context).thenCompose(subQuestions -> {
            logger.debug("Decomposed query into {} sub-question(s)", subQuestions.size());
            List<CompletableFuture<TraceResult>> branches = subQuestions.stream()
                .map(subQuestion -> branch(context.forSubQuestion(subQuestion), context))
                .toList();

            return CompletableFuture.allOf(branches.toArray(new CompletableFuture[0]))
                .thenCompose(ignored -> {
                    TraceResult merged = merge(branches.stream().map(CompletableFuture::join).toList(),
                        context.param().getTopK());
                    return synthesizer.synthesize(SynthesisRequest.forTrace(context, route(), merged)
                        .withSubQuestions(subQuestions)
                        .withExpander(expander));
                });
        });
    }

    private CompletableFuture<TraceResult> branch(QueryContext subContext, QueryContext parent) {
        CompletableFuture<TraceResult> trace = resolveSeeds(subContext.query(), subContext, extractor, disambiguator)
            .thenCompose(seeds -> tracer.expand(seeds, TraceMode.BEAM_SEARCH, subContext));
        return AsyncCalls.withTimeout(trace, parent.param().remaining(), "sub-question branch")
            .exceptionally(error -> {
                AsyncCalls.rethrowIfFatal(error);
                logger.warn("Sub-question branch '{}' failed, continuing without it: {}",
                    subContext.query(), AsyncCalls.unwrap(error).getMessage());
                return TraceResult.empty(TraceMode.BEAM_SEARCH);
            });
    }

    static TraceResult merge(List<TraceResult> results, int topK) {
        Map<String, RankedEntity> best = new LinkedHashMap<>();
        TraceQuality quality = TraceQuality.BEAM;
        for (TraceResult result : results) {
            if (result.isDegraded() && !result.isEmpty()) {
                quality = result.quality();
            }
            for (RankedEntity entity : result.entities()) {
                best.merge(entity.entityId(), entity, (a, b) -> b.score() > a.score() ? b : a);
            }
        }
        List<RankedEntity> ranked = new ArrayList<>(best.values());
        ranked.sort(Comparator.comparingDouble(RankedEntity::score).reversed().thenComparing(RankedEntity::entityId));
        return new TraceResult(ranked.subList(0, Math.min(Math.max(topK, 1) * Math.max(results.size(), 1),
            ranked.size())), TraceMode.BEAM_SEARCH, quality);
    }
}
