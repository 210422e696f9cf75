package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.MentionExtractor;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for route executors.
 * Each route has exactly one executor implementation.
 */
public abstract class RouteExecutor {

    protected static final Logger logger = LoggerFactory.getLogger(RouteExecutor.class);

    protected final Synthesizer synthesizer;

    protected RouteExecutor(@NotNull Synthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    @NotNull
    public abstract QueryRoute route();

    /**
     * Answers the query of {@code context} along this route.
     *
     * @return the answer; an answer without citations means no evidence was found
     */
    public abstract CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context);

    /**
     * Extracts mentions from {@code query} and resolves them to seed entities.
     */
    protected static CompletableFuture<List<RankedEntity>> resolveSeeds(
            @NotNull String query,
            @NotNull QueryContext context,
            @NotNull MentionExtractor extractor,
            @NotNull Disambiguator disambiguator) {
        return extractor.extract(query, context.param())
            .thenCompose(mentions -> disambiguator.resolve(mentions, context.param()))
            .thenApply(resolved -> resolved.stream()
                .map(entity -> new RankedEntity(entity.entityId(), entity.name(), entity.confidence()))
                .toList());
    }
}
