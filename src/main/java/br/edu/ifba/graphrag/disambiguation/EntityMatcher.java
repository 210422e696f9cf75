package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One step of the disambiguation cascade.
 */
public interface EntityMatcher {

    @NotNull
    MatchStrategy strategy();

    /**
     * Matches a batch of normalized mentions in the tenant of {@code param}.
     *
     * @return candidates keyed by mention; mentions without candidates may be absent
     */
    CompletableFuture<Map<String, List<MatchCandidate>>> match(@NotNull List<String> mentions, @NotNull QueryParam param);
}
