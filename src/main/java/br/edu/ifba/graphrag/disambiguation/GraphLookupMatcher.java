package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Exact, alias, structured-field and substring matching, each answered by a single batched
 * graph statement for all pending mentions.
 */
public class GraphLookupMatcher implements EntityMatcher {

    static final int MIN_SUBSTRING_OVERLAP = 3;

    private final MatchStrategy strategy;
    private final GraphQuery statement;
    private final GraphQueryGateway gateway;

    public GraphLookupMatcher(@NotNull MatchStrategy strategy, @NotNull GraphQueryGateway gateway) {
        this.strategy = strategy;
        this.statement = switch (strategy) {
            case EXACT -> GraphQuery.MATCH_EXACT_NAME;
            case ALIAS -> GraphQuery.MATCH_ALIAS;
            case STRUCTURED_FIELD -> GraphQuery.MATCH_FIELD_KEY;
            case SUBSTRING -> GraphQuery.MATCH_SUBSTRING;
            default -> throw new IllegalArgumentException(strategy + " is not a lookup strategy");
        };
        this.gateway = gateway;
    }

    @Override
    @NotNull
    public MatchStrategy strategy() {
        return strategy;
    }

    @Override
    public CompletableFuture<Map<String, List<MatchCandidate>>> match(@NotNull List<String> mentions, @NotNull QueryParam param) {
        List<String> eligible = strategy == MatchStrategy.SUBSTRING
            ? mentions.stream().filter(m -> m.length() >= MIN_SUBSTRING_OVERLAP).toList()
            : mentions;
        if (eligible.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }

        return gateway.query(
                TenantScopedQueryBuilder.forTenant(param.getTenant())
                    .statement(statement)
                    .param("mentions", eligible)
                    .build(),
                param.getStoreCallTimeout())
            .thenApply(this::toCandidates);
    }

    private Map<String, List<MatchCandidate>> toCandidates(List<GraphRow> rows) {
        Map<String, Map<String, MatchCandidate>> byMention = new LinkedHashMap<>();
        for (GraphRow row : rows) {
            String mention = row.requireString("mention");
            String matched = row.requireString("matched");
            if (strategy == MatchStrategy.SUBSTRING && overlap(mention, matched) < MIN_SUBSTRING_OVERLAP) {
                continue;
            }
            MatchCandidate candidate = new MatchCandidate(
                row.requireString("entity_id"), row.requireString("name"), matched, strategy.confidence());
            Map<String, MatchCandidate> candidates = byMention.computeIfAbsent(mention, k -> new LinkedHashMap<>());
            MatchCandidate existing = candidates.get(candidate.entityId());
            if (existing == null || MatchCandidate.ranking(mention).compare(candidate, existing) < 0) {
                candidates.put(candidate.entityId(), candidate);
            }
        }
        Map<String, List<MatchCandidate>> result = new HashMap<>();
        byMention.forEach((mention, candidates) -> result.put(mention, new ArrayList<>(candidates.values())));
        return result;
    }

    static int overlap(String mention, String matched) {
        String normalized = TextNormalizer.normalize(matched);
        if (normalized.contains(mention)) {
            return mention.length();
        }
        if (mention.contains(normalized)) {
            return normalized.length();
        }
        return 0;
    }
}
