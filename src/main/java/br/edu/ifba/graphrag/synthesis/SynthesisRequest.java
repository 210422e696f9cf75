package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.trace.TraceResult;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Input of one synthesis: either ranked entities whose chunks are fetched, or chunks that
 * were retrieved directly.
 *
 * @param context      query being answered
 * @param route        route producing the answer; selects the prompt
 * @param entities     ranked entities, empty for direct chunk evidence
 * @param chunks       directly retrieved chunks, empty for entity evidence
 * @param degraded     whether tracing ran on an approximation
 * @param subQuestions requirements for multi-part questions, empty otherwise
 * @param expander     source of further entities for the gap-fill loop
 */
public record SynthesisRequest(
        @NotNull QueryContext context,
        @NotNull QueryRoute route,
        @NotNull List<RankedEntity> entities,
        @NotNull List<Chunk> chunks,
        boolean degraded,
        @NotNull List<String> subQuestions,
        @NotNull EvidenceExpander expander
) {
    public SynthesisRequest {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(route, "route must not be null");
        entities = entities != null ? List.copyOf(entities) : List.of();
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
        subQuestions = subQuestions != null ? List.copyOf(subQuestions) : List.of();
        expander = expander != null ? expander : EvidenceExpander.NONE;
    }

    public static SynthesisRequest forTrace(
            @NotNull QueryContext context, @NotNull QueryRoute route, @NotNull TraceResult trace) {
        return new SynthesisRequest(context, route, trace.entities(), List.of(), trace.isDegraded(),
            List.of(), EvidenceExpander.NONE);
    }

    public static SynthesisRequest forChunks(
            @NotNull QueryContext context, @NotNull QueryRoute route, @NotNull List<Chunk> chunks) {
        return new SynthesisRequest(context, route, List.of(), chunks, false, List.of(), EvidenceExpander.NONE);
    }

    public SynthesisRequest withSubQuestions(@NotNull List<String> questions) {
        return new SynthesisRequest(context, route, entities, chunks, degraded, questions, expander);
    }

    public SynthesisRequest withExpander(@NotNull EvidenceExpander gapExpander) {
        return new SynthesisRequest(context, route, entities, chunks, degraded, subQuestions, gapExpander);
    }

    public boolean hasDirectChunks() {
        return !chunks.isEmpty();
    }
}
