package br.edu.ifba.graphrag.trace;

import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.embedding.EmbeddingFunction;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import br.edu.ifba.graphrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Query-guided beam search over the entity graph.
 *
 * <p>Each hop issues one batched neighbor lookup for the whole beam and at most one batched
 * embedding call for neighbors stored without a vector. Neighbors are scored by cosine
 * similarity to the query embedding; the best {@code beamWidth} form the next beam. The first
 * discovery of an entity fixes its score, so an entity is never rescored on a later hop.
 * Among equal scores, the neighbor reached from more distinct beam members wins.</p>
 */
public class BeamSearchTracer {

    private static final Logger logger = LoggerFactory.getLogger(BeamSearchTracer.class);

    static final int NEIGHBOR_LIMIT_PER_NODE = 100;
    static final double SEED_SCORE = 1.0;

    private final GraphQueryGateway gateway;
    private final EmbeddingFunction embeddingFunction;

    public BeamSearchTracer(@NotNull GraphQueryGateway gateway, @NotNull EmbeddingFunction embeddingFunction) {
        this.gateway = gateway;
        this.embeddingFunction = embeddingFunction;
    }

    public CompletableFuture<TraceResult> expand(@NotNull List<RankedEntity> seeds, @NotNull QueryContext context) {
        Map<String, RankedEntity> kept = new LinkedHashMap<>();
        for (RankedEntity seed : seeds) {
            kept.putIfAbsent(seed.entityId(), seed.withScore(SEED_SCORE));
        }
        Set<String> visited = new HashSet<>(kept.keySet());
        List<String> beam = new ArrayList<>(kept.keySet());

        return context.queryEmbedding(embeddingFunction)
            .thenCompose(queryVector -> hop(1, beam, new BeamState(kept, visited, queryVector), context))
            .thenApply(state -> {
                List<RankedEntity> ranked = new ArrayList<>(state.kept.values());
                ranked.sort(Comparator.comparingDouble(RankedEntity::score).reversed()
                    .thenComparing(RankedEntity::entityId));
                int limit = Math.max(context.param().getTopK(), kept.size());
                return new TraceResult(ranked.subList(0, Math.min(limit, ranked.size())),
                    TraceMode.BEAM_SEARCH, TraceQuality.BEAM);
            });
    }

    private CompletableFuture<BeamState> hop(int depth, List<String> beam, BeamState state, QueryContext context) {
        QueryParam param = context.param();
        if (beam.isEmpty() || depth > param.getMaxHops()) {
            return CompletableFuture.completedFuture(state);
        }

        TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(param.getTenant())
            .statement(GraphQuery.NEIGHBORS_BATCH)
            .param("entity_ids", beam)
            .param("limit_per_node", NEIGHBOR_LIMIT_PER_NODE)
            .build();

        return gateway.query(statement, param.getStoreCallTimeout())
            .thenCompose(rows -> {
                Map<String, Candidate> candidates = collectCandidates(rows, state.visited);
                if (candidates.isEmpty()) {
                    logger.debug("Beam exhausted at hop {} for tenant {}", depth, param.getTenant());
                    return CompletableFuture.completedFuture(state);
                }
                return fillMissingEmbeddings(candidates, param).thenCompose(ignored -> {
                    List<String> nextBeam = select(candidates, state, param.getBeamWidth());
                    logger.debug("Hop {} kept {} of {} neighbor(s)", depth, nextBeam.size(), candidates.size());
                    return hop(depth + 1, nextBeam, state, context);
                });
            });
    }

    private static Map<String, Candidate> collectCandidates(List<GraphRow> rows, Set<String> visited) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (GraphRow row : rows) {
            String entityId = row.requireString("entity_id");
            if (visited.contains(entityId)) {
                continue;
            }
            Candidate candidate = candidates.computeIfAbsent(entityId,
                id -> new Candidate(id, row.getString("name"), row.getEmbedding("embedding")));
            String source = row.getString("source_id");
            if (source != null) {
                candidate.sources.add(source);
            }
        }
        return candidates;
    }

    private CompletableFuture<Void> fillMissingEmbeddings(Map<String, Candidate> candidates, QueryParam param) {
        List<Candidate> missing = candidates.values().stream()
            .filter(c -> c.embedding == null)
            .toList();
        if (missing.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<String> texts = missing.stream().map(Candidate::label).toList();
        return AsyncCalls.withTimeout(embeddingFunction.embedBatch(texts), param.getEmbeddingCallTimeout(),
                "neighbor embeddings")
            .thenAccept(vectors -> {
                for (int i = 0; i < missing.size() && i < vectors.size(); i++) {
                    missing.get(i).embedding = vectors.get(i);
                }
            });
    }

    private static List<String> select(Map<String, Candidate> candidates, BeamState state, int beamWidth) {
        List<Candidate> ordered = new ArrayList<>(candidates.values());
        ordered.forEach(c -> c.score = EmbeddingUtil.similarityOrZero(state.queryVector, c.embedding));
        ordered.sort(Candidate.ORDER);
        state.visited.addAll(candidates.keySet());

        List<String> nextBeam = new ArrayList<>();
        for (Candidate candidate : ordered.subList(0, Math.min(beamWidth, ordered.size()))) {
            nextBeam.add(candidate.entityId);
            state.kept.put(candidate.entityId, new RankedEntity(candidate.entityId, candidate.label(), candidate.score));
        }
        return nextBeam;
    }

    private record BeamState(Map<String, RankedEntity> kept, Set<String> visited, float[] queryVector) {
    }

    private static final class Candidate {

        static final Comparator<Candidate> ORDER = Comparator.<Candidate>comparingDouble(c -> -c.score)
            .thenComparingInt(c -> -c.sources.size())
            .thenComparing(c -> c.entityId);

        final String entityId;
        final String name;
        final Set<String> sources = new LinkedHashSet<>();
        float[] embedding;
        double score;

        Candidate(String entityId, String name, float[] embedding) {
            this.entityId = entityId;
            this.name = name;
            this.embedding = embedding;
        }

        String label() {
            return name != null ? name : entityId;
        }
    }
}
