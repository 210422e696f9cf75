package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Final answer of the pipeline.
 *
 * @param routeUsed   the route that produced this answer, after any fallback
 * @param answer      answer text with {@code [n]} citation markers
 * @param citations   citations referenced by the markers
 * @param confidence  confidence in [0, 1]
 * @param provisional true when the answer was cut short by the deadline or a failed completion
 * @param degraded    true when tracing ran on an approximation
 */
public record GraphRagAnswer(
        @NotNull QueryRoute routeUsed,
        @NotNull String answer,
        @NotNull List<Citation> citations,
        double confidence,
        boolean provisional,
        boolean degraded
) {
    public static final String INSUFFICIENT_EVIDENCE = "insufficient evidence";

    public GraphRagAnswer {
        Objects.requireNonNull(routeUsed, "routeUsed must not be null");
        Objects.requireNonNull(answer, "answer must not be null");
        citations = citations != null ? List.copyOf(citations) : List.of();
    }

    public static GraphRagAnswer insufficientEvidence(@NotNull QueryRoute route, boolean degraded) {
        return new GraphRagAnswer(route, INSUFFICIENT_EVIDENCE, List.of(), 0.0, false, degraded);
    }

    public boolean hasEvidence() {
        return !citations.isEmpty();
    }
}
