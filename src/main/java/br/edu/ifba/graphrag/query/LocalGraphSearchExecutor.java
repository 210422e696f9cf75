package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.MentionExtractor;
import br.edu.ifba.graphrag.synthesis.EvidenceExpander;
import br.edu.ifba.graphrag.synthesis.SynthesisRequest;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import br.edu.ifba.graphrag.trace.TraceMode;
import br.edu.ifba.graphrag.trace.Tracer;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Executes LOCAL_GRAPH_SEARCH: resolve the named entities of the query, beam search around
 * them and synthesize from the chunks mentioning the traced entities.
 */
public class LocalGraphSearchExecutor extends RouteExecutor {

    private final MentionExtractor extractor;
    private final Disambiguator disambiguator;
    private final Tracer tracer;
    private final EvidenceExpander expander;

    public LocalGraphSearchExecutor(
            @NotNull Synthesizer synthesizer,
            @NotNull MentionExtractor extractor,
            @NotNull Disambiguator disambiguator,
            @NotNull Tracer tracer,
            @NotNull EvidenceExpander expander) {
        super(synthesizer);
        this.extractor = extractor;
        this.disambiguator = disambiguator;
        this.tracer = tracer;
        this.expander = expander;
    }

    @Override
    public @NotNull QueryRoute route() {
        return QueryRoute.LOCAL_GRAPH_SEARCH;
    }

    @Override
    public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context) {
        return resolveSeeds(context.query(), context, extractor, disambiguator)
            .thenCompose(seeds -> {
                logger.debug("Local search resolved {} seed(s)", seeds.size());
                return tracer.expand(seeds, TraceMode.BEAM_SEARCH, context);
            })
            .thenCompose(trace -> synthesizer.synthesize(
                SynthesisRequest.forTrace(context, route(), trace).withExpander(expander)));
    }
}
