package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves free-text mentions to entity ids of one tenant.
 *
 * <p>Strategies run in a fixed cascade (exact, alias, structured field, substring, token
 * overlap, vector similarity). All pending mentions are matched in one batch per strategy;
 * a mention leaves the cascade at the first strategy that yields candidates, so a higher
 * precedence match is never replaced by a lower one. Mentions that nothing matches are
 * dropped; an empty result is a valid outcome.</p>
 */
@ApplicationScoped
public class Disambiguator {

    private static final Logger logger = LoggerFactory.getLogger(Disambiguator.class);

    private final List<EntityMatcher> cascade;

    @Inject
    public Disambiguator(GraphQueryGateway gateway, EmbeddingFunction embeddingFunction) {
        this(defaultCascade(gateway, embeddingFunction));
    }

    public Disambiguator(@NotNull List<EntityMatcher> cascade) {
        this.cascade = List.copyOf(cascade);
    }

    static List<EntityMatcher> defaultCascade(GraphQueryGateway gateway, EmbeddingFunction embeddingFunction) {
        EntityCatalog catalog = new EntityCatalog(gateway);
        return List.of(
            new GraphLookupMatcher(MatchStrategy.EXACT, gateway),
            new GraphLookupMatcher(MatchStrategy.ALIAS, gateway),
            new GraphLookupMatcher(MatchStrategy.STRUCTURED_FIELD, gateway),
            new GraphLookupMatcher(MatchStrategy.SUBSTRING, gateway),
            new TokenOverlapMatcher(catalog),
            new VectorSimilarityMatcher(gateway, catalog, embeddingFunction));
    }

    /**
     * Resolves mentions in the tenant of {@code param}.
     *
     * @return resolved entities, deduplicated by id and ordered by confidence
     */
    public CompletableFuture<List<ResolvedEntity>> resolve(@NotNull List<String> mentions, @NotNull QueryParam param) {
        List<String> pending = new ArrayList<>(new LinkedHashSet<>(mentions.stream()
            .map(TextNormalizer::normalize)
            .filter(m -> !m.isEmpty())
            .toList()));
        Map<String, List<ResolvedEntity>> resolved = new LinkedHashMap<>();
        pending.forEach(m -> resolved.put(m, List.of()));

        return runCascade(0, pending, resolved, param).thenApply(done -> {
            List<ResolvedEntity> result = merge(done);
            logger.debug("Resolved {} mention(s) to {} entity(ies) for tenant {}",
                mentions.size(), result.size(), param.getTenant());
            return result;
        });
    }

    private CompletableFuture<Map<String, List<ResolvedEntity>>> runCascade(
            int step, List<String> pending, Map<String, List<ResolvedEntity>> resolved, QueryParam param) {
        if (pending.isEmpty() || step >= cascade.size()) {
            return CompletableFuture.completedFuture(resolved);
        }
        EntityMatcher matcher = cascade.get(step);

        return matcher.match(pending, param)
            .exceptionally(error -> {
                AsyncCalls.rethrowIfFatal(error);
                logger.warn("{} matching failed for tenant {}, continuing cascade: {}",
                    matcher.strategy(), param.getTenant(), AsyncCalls.unwrap(error).getMessage());
                return Map.of();
            })
            .thenCompose(candidatesByMention -> {
                List<String> stillPending = new ArrayList<>();
                for (String mention : pending) {
                    List<MatchCandidate> candidates = candidatesByMention.getOrDefault(mention, List.of());
                    if (candidates.isEmpty()) {
                        stillPending.add(mention);
                        continue;
                    }
                    resolved.put(mention, candidates.stream()
                        .sorted(MatchCandidate.ranking(mention))
                        .limit(param.getMaxCandidatesPerMention())
                        .map(c -> new ResolvedEntity(c.entityId(), c.name(), c.confidence(), matcher.strategy(), mention))
                        .toList());
                }
                return runCascade(step + 1, stillPending, resolved, param);
            });
    }

    private static List<ResolvedEntity> merge(Map<String, List<ResolvedEntity>> resolved) {
        Map<String, ResolvedEntity> byEntity = new LinkedHashMap<>();
        for (List<ResolvedEntity> perMention : resolved.values()) {
            for (ResolvedEntity entity : perMention) {
                byEntity.merge(entity.entityId(), entity,
                    (existing, candidate) -> candidate.confidence() > existing.confidence() ? candidate : existing);
            }
        }
        List<ResolvedEntity> result = new ArrayList<>(byEntity.values());
        result.sort(Comparator.comparingDouble(ResolvedEntity::confidence).reversed());
        return result;
    }
}
