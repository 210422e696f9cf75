package br.edu.ifba.graphrag.trace;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Personalized PageRank around the seed entities.
 *
 * <p>Uses the store's native ranking when available. Otherwise, or when the native call
 * fails, a distance-decay approximation is computed from two batched neighbor lookups:
 * seeds score 1.0, each path of length one adds {@code damping}, each path of length two
 * adds {@code damping²}. If that also fails the seeds are returned with uniform weight.
 * Both fallbacks are reported as degraded.</p>
 */
public class PersonalizedRankTracer {

    private static final Logger logger = LoggerFactory.getLogger(PersonalizedRankTracer.class);

    static final double SEED_WEIGHT = 1.0;

    private final GraphQueryGateway gateway;

    public PersonalizedRankTracer(@NotNull GraphQueryGateway gateway) {
        this.gateway = gateway;
    }

    public CompletableFuture<TraceResult> expand(@NotNull List<RankedEntity> seeds, @NotNull QueryParam param) {
        if (seeds.isEmpty()) {
            return CompletableFuture.completedFuture(TraceResult.empty(TraceMode.APPROXIMATE_RANK));
        }
        CompletableFuture<TraceResult> ranked = gateway.supports(GraphCapability.NATIVE_RANKING)
            ? nativeRank(seeds, param).exceptionallyCompose(error -> {
                AsyncCalls.rethrowIfFatal(error);
                logger.warn("Native ranking failed for tenant {}, using approximation: {}",
                    param.getTenant(), AsyncCalls.unwrap(error).getMessage());
                return approximateRank(seeds, param);
            })
            : approximateRank(seeds, param);

        return ranked.exceptionally(error -> {
            AsyncCalls.rethrowIfFatal(error);
            logger.warn("Approximate ranking failed for tenant {}, returning seeds only: {}",
                param.getTenant(), AsyncCalls.unwrap(error).getMessage());
            return seedOnly(seeds);
        });
    }

    private CompletableFuture<TraceResult> nativeRank(List<RankedEntity> seeds, QueryParam param) {
        TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
            .statement(GraphQuery.NATIVE_PERSONALIZED_RANK)
            .param("seed_ids", seedIds(seeds))
            .param("damping", param.getDamping())
            .param("max_iterations", param.getMaxIterations())
            .param("top_k", param.getTopK())
            .build();
        return gateway.query(statement, param.getStoreCallTimeout()).thenApply(rows -> {
            List<RankedEntity> entities = rows.stream()
                .map(row -> new RankedEntity(row.requireString("entity_id"),
                    nameOf(row), row.getDouble("score", 0.0)))
                .toList();
            return new TraceResult(entities, TraceMode.APPROXIMATE_RANK, TraceQuality.NATIVE);
        });
    }

    CompletableFuture<TraceResult> approximateRank(List<RankedEntity> seeds, QueryParam param) {
        Map<String, Double> scores = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        List<String> seedIds = seedIds(seeds);
        for (RankedEntity seed : seeds) {
            scores.merge(seed.entityId(), SEED_WEIGHT, Math::max);
            names.putIfAbsent(seed.entityId(), seed.name());
        }
        double damping = param.getDamping();

        return neighbors(seedIds, param.getOneHopLimit(), param).thenCompose(firstHop -> {
            Map<String, Double> pathWeight = new LinkedHashMap<>();
            for (GraphRow row : firstHop) {
                String neighbor = row.requireString("entity_id");
                names.putIfAbsent(neighbor, nameOf(row));
                scores.merge(neighbor, damping, Double::sum);
                pathWeight.merge(neighbor, damping, Double::sum);
            }
            if (pathWeight.isEmpty()) {
                return CompletableFuture.completedFuture(rank(scores, names, param));
            }
            return neighbors(new ArrayList<>(pathWeight.keySet()), param.getTwoHopLimit(), param)
                .thenApply(secondHop -> {
                    for (GraphRow row : secondHop) {
                        String neighbor = row.requireString("entity_id");
                        String via = row.getString("source_id");
                        names.putIfAbsent(neighbor, nameOf(row));
                        // paths reaching the intermediate node, each extended by one more decayed hop
                        double paths = via != null ? pathWeight.getOrDefault(via, damping) / damping : 1.0;
                        scores.merge(neighbor, paths * damping * damping, Double::sum);
                    }
                    return rank(scores, names, param);
                });
        });
    }

    private CompletableFuture<List<GraphRow>> neighbors(List<String> ids, int limitPerNode, QueryParam param) {
        TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
            .statement(GraphQuery.NEIGHBORS_BATCH)
            .param("entity_ids", ids)
            .param("limit_per_node", limitPerNode)
            .build();
        return gateway.query(statement, param.getStoreCallTimeout());
    }

    private static TraceResult rank(Map<String, Double> scores, Map<String, String> names, QueryParam param) {
        List<RankedEntity> entities = scores.entrySet().stream()
            .map(e -> new RankedEntity(e.getKey(), names.getOrDefault(e.getKey(), e.getKey()), e.getValue()))
            .sorted(Comparator.comparingDouble(RankedEntity::score).reversed().thenComparing(RankedEntity::entityId))
            .limit(param.getTopK())
            .toList();
        return new TraceResult(entities, TraceMode.APPROXIMATE_RANK, TraceQuality.APPROXIMATE);
    }

    private static TraceResult seedOnly(List<RankedEntity> seeds) {
        Map<String, RankedEntity> unique = new LinkedHashMap<>();
        seeds.forEach(seed -> unique.putIfAbsent(seed.entityId(), seed.withScore(SEED_WEIGHT)));
        return new TraceResult(new ArrayList<>(unique.values()), TraceMode.APPROXIMATE_RANK, TraceQuality.SEED_ONLY);
    }

    private static List<String> seedIds(List<RankedEntity> seeds) {
        return seeds.stream().map(RankedEntity::entityId).distinct().toList();
    }

    private static String nameOf(GraphRow row) {
        String name = row.getString("name");
        return name != null ? name : row.requireString("entity_id");
    }
}
