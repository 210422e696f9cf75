package br.edu.ifba.graphrag.trace;

import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Expands resolved seed entities into a ranked set of related entities.
 *
 * <p>Beam search failures that are not fatal (embedding errors, timeouts, degraded store
 * calls) fall back to approximate ranking; the result then reports the mode that ran.</p>
 */
@ApplicationScoped
public class Tracer {

    private static final Logger logger = LoggerFactory.getLogger(Tracer.class);

    private final BeamSearchTracer beamSearch;
    private final PersonalizedRankTracer personalizedRank;

    @Inject
    public Tracer(GraphQueryGateway gateway, EmbeddingFunction embeddingFunction) {
        this(new BeamSearchTracer(gateway, embeddingFunction), new PersonalizedRankTracer(gateway));
    }

    public Tracer(@NotNull BeamSearchTracer beamSearch, @NotNull PersonalizedRankTracer personalizedRank) {
        this.beamSearch = beamSearch;
        this.personalizedRank = personalizedRank;
    }

    public CompletableFuture<TraceResult> expand(
            @NotNull List<RankedEntity> seeds, @NotNull TraceMode mode, @NotNull QueryContext context) {
        if (seeds.isEmpty()) {
            return CompletableFuture.completedFuture(TraceResult.empty(mode));
        }
        if (mode == TraceMode.APPROXIMATE_RANK) {
            return personalizedRank.expand(seeds, context.param());
        }
        return beamSearch.expand(seeds, context).exceptionallyCompose(error -> {
            AsyncCalls.rethrowIfFatal(error);
            logger.warn("Beam search failed for tenant {}, falling back to approximate ranking: {}",
                context.tenant(), AsyncCalls.unwrap(error).getMessage());
            return personalizedRank.expand(seeds, context.param());
        });
    }
}
