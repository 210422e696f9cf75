package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Jaccard overlap between mention tokens and entity name tokens over the tenant's entity
 * catalog.
 */
public class TokenOverlapMatcher implements EntityMatcher {

    static final double MIN_OVERLAP = 0.5;

    private final EntityCatalog catalog;

    public TokenOverlapMatcher(@NotNull EntityCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    @NotNull
    public MatchStrategy strategy() {
        return MatchStrategy.TOKEN_OVERLAP;
    }

    @Override
    public CompletableFuture<Map<String, List<MatchCandidate>>> match(@NotNull List<String> mentions, @NotNull QueryParam param) {
        return catalog.load(param).thenApply(entries -> {
            Map<String, List<MatchCandidate>> result = new HashMap<>();
            for (String mention : mentions) {
                List<MatchCandidate> candidates = new ArrayList<>();
                for (EntityCatalog.Entry entry : entries) {
                    double overlap = TextNormalizer.jaccard(mention, entry.name());
                    if (overlap > MIN_OVERLAP) {
                        candidates.add(new MatchCandidate(entry.entityId(), entry.name(), entry.name(),
                            strategy().confidence() * overlap));
                    }
                }
                if (!candidates.isEmpty()) {
                    result.put(mention, candidates);
                }
            }
            return result;
        });
    }
}
