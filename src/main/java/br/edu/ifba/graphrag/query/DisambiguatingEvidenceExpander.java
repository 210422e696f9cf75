package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.HeuristicMentionExtractor;
import br.edu.ifba.graphrag.synthesis.EvidenceExpander;
import br.edu.ifba.graphrag.trace.TraceMode;
import br.edu.ifba.graphrag.trace.Tracer;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Gap-fill expansion in two steps. Uncovered requirements are resolved to new seed
 * entities through the disambiguator (whole sub-questions are first mined for mentions),
 * then the tracer runs again from the new and the known seeds with a wider beam and one
 * more hop than the first pass.
 */
public class DisambiguatingEvidenceExpander implements EvidenceExpander {

    private static final Logger logger = LoggerFactory.getLogger(DisambiguatingEvidenceExpander.class);

    static final int BEAM_WIDENING = 5;

    private final Disambiguator disambiguator;
    private final HeuristicMentionExtractor mentionExtractor;
    private final Tracer tracer;

    public DisambiguatingEvidenceExpander(@NotNull Disambiguator disambiguator,
                                          @NotNull HeuristicMentionExtractor mentionExtractor,
                                          @NotNull Tracer tracer) {
        this.disambiguator = disambiguator;
        this.mentionExtractor = mentionExtractor;
        this.tracer = tracer;
    }

    @Override
    public CompletableFuture<List<RankedEntity>> expand(
            @NotNull List<String> gaps, @NotNull List<RankedEntity> known, @NotNull QueryContext context) {
        Set<String> mentions = new LinkedHashSet<>();
        for (String gap : gaps) {
            if (gap.strip().contains(" ")) {
                mentions.addAll(mentionExtractor.extract(gap));
            } else {
                mentions.add(gap);
            }
        }
        if (mentions.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        Set<String> knownIds = new LinkedHashSet<>();
        known.forEach(entity -> knownIds.add(entity.entityId()));

        return disambiguator.resolve(new ArrayList<>(mentions), context.param())
            .thenApply(resolved -> resolved.stream()
                .map(entity -> new RankedEntity(entity.entityId(), entity.name(), entity.confidence()))
                .filter(entity -> !knownIds.contains(entity.entityId()))
                .toList())
            .thenCompose(newSeeds -> newSeeds.isEmpty()
                ? CompletableFuture.completedFuture(List.<RankedEntity>of())
                : retrace(newSeeds, known, context));
    }

    private CompletableFuture<List<RankedEntity>> retrace(
            List<RankedEntity> newSeeds, List<RankedEntity> known, QueryContext context) {
        if (context.param().isDeadlineReached()) {
            return CompletableFuture.completedFuture(newSeeds);
        }
        List<RankedEntity> seeds = new ArrayList<>(newSeeds);
        seeds.addAll(known);
        QueryContext widened = context.withParam(widen(context.param()));

        return tracer.expand(seeds, TraceMode.BEAM_SEARCH, widened)
            .handle((trace, error) -> {
                if (error != null) {
                    AsyncCalls.rethrowIfFatal(error);
                    logger.warn("Gap-fill trace failed, using resolved seeds only: {}",
                        AsyncCalls.unwrap(error).getMessage());
                    return newSeeds;
                }
                Map<String, RankedEntity> merged = new LinkedHashMap<>();
                newSeeds.forEach(entity -> merged.put(entity.entityId(), entity));
                trace.entities().forEach(entity -> merged.putIfAbsent(entity.entityId(), entity));
                logger.debug("Gap-fill trace from {} seed(s) found {} entities", seeds.size(), merged.size());
                return List.copyOf(merged.values());
            });
    }

    static QueryParam widen(QueryParam param) {
        return param.toBuilder()
            .beamWidth(param.getBeamWidth() + BEAM_WIDENING)
            .maxHops(param.getMaxHops() + 1)
            .build();
    }
}
