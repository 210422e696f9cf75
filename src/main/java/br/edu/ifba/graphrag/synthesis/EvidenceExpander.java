package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.RankedEntity;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Finds further entities for requirements the current evidence does not cover.
 * Used by the gap-fill loop.
 */
@FunctionalInterface
public interface EvidenceExpander {

    EvidenceExpander NONE = (gaps, known, context) -> CompletableFuture.completedFuture(List.of());

    /**
     * @param gaps  requirements with no supporting evidence yet
     * @param known entities whose evidence is already in the answer
     */
    CompletableFuture<List<RankedEntity>> expand(
        @NotNull List<String> gaps, @NotNull List<RankedEntity> known, @NotNull QueryContext context);
}
