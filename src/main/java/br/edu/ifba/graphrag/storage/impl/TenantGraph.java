package br.edu.ifba.graphrag.storage.impl;

import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.ChunkNode;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.DocumentNode;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.EntityNode;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.KeyValueNode;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.SectionNode;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot.TenantSnapshot;
import br.edu.ifba.graphrag.utils.EmbeddingUtil;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Indexed, immutable graph of one tenant. Answers every
 * {@link br.edu.ifba.graphrag.storage.GraphQuery} by direct traversal.
 */
final class TenantGraph {

    private static final double CONVERGENCE_THRESHOLD = 1e-6;

    private final String groupId;
    private final Map<String, DocumentNode> documents = new HashMap<>();
    private final Map<String, SectionNode> sections = new HashMap<>();
    private final Map<String, ChunkNode> chunks = new HashMap<>();
    private final Map<String, EntityNode> entities = new TreeMap<>();
    private final Map<String, List<String>> chunksByEntity = new HashMap<>();
    private final Map<String, Set<String>> entitiesByChunk = new HashMap<>();
    private final Map<String, Map<String, Double>> related = new HashMap<>();
    private final Map<String, Map<String, Double>> similarSections = new HashMap<>();
    private final List<KeyValueNode> keyValuePairs;

    TenantGraph(@NotNull String groupId, @NotNull TenantSnapshot snapshot) {
        this.groupId = groupId;
        snapshot.documents().forEach(d -> documents.put(d.id(), d));
        snapshot.sections().forEach(s -> sections.put(s.id(), s));
        snapshot.chunks().forEach(c -> chunks.put(c.id(), c));
        snapshot.entities().forEach(e -> entities.put(e.id(), e));

        snapshot.mentions().forEach(m -> {
            requireChunk(m.chunkId());
            requireEntity(m.entityId());
            chunksByEntity.computeIfAbsent(m.entityId(), k -> new ArrayList<>()).add(m.chunkId());
            entitiesByChunk.computeIfAbsent(m.chunkId(), k -> new LinkedHashSet<>()).add(m.entityId());
        });
        Comparator<String> byOrdinal = Comparator.<String>comparingInt(id -> chunks.get(id).ordinal())
            .thenComparing(Comparator.naturalOrder());
        chunksByEntity.values().forEach(list -> {
            List<String> distinct = new ArrayList<>(new LinkedHashSet<>(list));
            distinct.sort(byOrdinal);
            list.clear();
            list.addAll(distinct);
        });

        snapshot.relations().forEach(r -> {
            requireEntity(r.source());
            requireEntity(r.target());
            if (r.source().equals(r.target())) {
                return;
            }
            double weight = r.weight() != null ? r.weight() : 1.0;
            related.computeIfAbsent(r.source(), k -> new TreeMap<>()).merge(r.target(), weight, Math::max);
            related.computeIfAbsent(r.target(), k -> new TreeMap<>()).merge(r.source(), weight, Math::max);
        });

        snapshot.sectionSimilarities().forEach(s -> {
            requireSection(s.source());
            requireSection(s.target());
            similarSections.computeIfAbsent(s.source(), k -> new TreeMap<>()).merge(s.target(), s.weight(), Math::max);
            similarSections.computeIfAbsent(s.target(), k -> new TreeMap<>()).merge(s.source(), s.weight(), Math::max);
        });

        snapshot.keyValuePairs().forEach(kv -> requireEntity(kv.entityId()));
        this.keyValuePairs = snapshot.keyValuePairs();
    }

    int entityCount() {
        return entities.size();
    }

    List<Map<String, Object>> execute(@NotNull TenantScopedStatement statement) {
        return switch (statement.query()) {
            case MATCH_EXACT_NAME -> matchEntities(statement.param("mentions"), MatchKind.EXACT);
            case MATCH_ALIAS -> matchEntities(statement.param("mentions"), MatchKind.ALIAS);
            case MATCH_FIELD_KEY -> matchFieldKeys(statement.param("mentions"));
            case MATCH_SUBSTRING -> matchEntities(statement.param("mentions"), MatchKind.SUBSTRING);
            case ENTITY_CATALOG -> entityCatalog(intParam(statement, "limit"));
            case ENTITY_VECTOR_SEARCH -> entityVectorSearch(statement.param("embedding"), intParam(statement, "top_k"));
            case ENTITIES_BY_ID -> entitiesById(statement.param("entity_ids"));
            case NEIGHBORS_BATCH -> neighbors(statement.param("entity_ids"), intParam(statement, "limit_per_node"));
            case NATIVE_PERSONALIZED_RANK -> personalizedRank(
                statement.param("seed_ids"),
                ((Number) statement.param("damping")).doubleValue(),
                intParam(statement, "max_iterations"),
                intParam(statement, "top_k"));
            case CHUNKS_FOR_ENTITIES -> chunksForEntities(statement.param("entity_ids"), intParam(statement, "limit_per_entity"));
            case CHUNK_VECTOR_SEARCH -> chunkVectorSearch(statement.param("embedding"), intParam(statement, "top_k"));
            case HUB_ENTITIES -> hubEntities(intParam(statement, "top_k"));
        };
    }

    private enum MatchKind { EXACT, ALIAS, SUBSTRING }

    private List<Map<String, Object>> matchEntities(List<String> mentions, MatchKind kind) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String mention : mentions) {
            for (EntityNode entity : entities.values()) {
                String name = TextNormalizer.normalize(entity.name());
                switch (kind) {
                    case EXACT -> {
                        if (name.equals(mention)) {
                            rows.add(matchRow(mention, entity, entity.name()));
                        }
                    }
                    case ALIAS -> {
                        if (entity.aliases() != null) {
                            for (String alias : entity.aliases()) {
                                if (TextNormalizer.normalize(alias).equals(mention)) {
                                    rows.add(matchRow(mention, entity, alias));
                                }
                            }
                        }
                    }
                    case SUBSTRING -> {
                        if (!name.isEmpty() && (name.contains(mention) || mention.contains(name))) {
                            rows.add(matchRow(mention, entity, entity.name()));
                        }
                    }
                }
            }
        }
        return rows;
    }

    private List<Map<String, Object>> matchFieldKeys(List<String> mentions) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String mention : mentions) {
            for (KeyValueNode kv : keyValuePairs) {
                if (TextNormalizer.normalize(kv.key()).equals(mention)) {
                    rows.add(matchRow(mention, entities.get(kv.entityId()), kv.key()));
                }
            }
        }
        return rows;
    }

    private Map<String, Object> matchRow(String mention, EntityNode entity, String matched) {
        Map<String, Object> row = row();
        row.put("mention", mention);
        row.put("entity_id", entity.id());
        row.put("name", entity.name());
        row.put("matched", matched);
        return row;
    }

    private List<Map<String, Object>> entityCatalog(int limit) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EntityNode entity : entities.values()) {
            if (rows.size() >= limit) {
                break;
            }
            Map<String, Object> row = entityRow(entity);
            row.put("degree", degree(entity.id()));
            rows.add(row);
        }
        return rows;
    }

    private List<Map<String, Object>> entitiesById(List<String> ids) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            EntityNode entity = entities.get(id);
            if (entity != null) {
                rows.add(entityRow(entity));
            }
        }
        return rows;
    }

    private List<Map<String, Object>> entityVectorSearch(float[] query, int topK) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EntityNode entity : entities.values()) {
            float[] embedding = toArray(entity.embedding());
            if (embedding == null || embedding.length != query.length) {
                continue;
            }
            Map<String, Object> row = row();
            row.put("entity_id", entity.id());
            row.put("name", entity.name());
            row.put("score", EmbeddingUtil.cosineSimilarity(query, embedding));
            rows.add(row);
        }
        return topByScore(rows, "score", topK);
    }

    /**
     * RELATED_TO neighbors plus entities mentioned in semantically similar sections.
     * One row per distinct (source, neighbor) pair; RELATED_TO wins over the derived edge.
     */
    private List<Map<String, Object>> neighbors(List<String> sourceIds, int limitPerNode) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String sourceId : new LinkedHashSet<>(sourceIds)) {
            if (!entities.containsKey(sourceId)) {
                continue;
            }
            Map<String, Map<String, Object>> bySource = new LinkedHashMap<>();
            related.getOrDefault(sourceId, Map.of()).forEach((neighborId, weight) ->
                bySource.put(neighborId, neighborRow(sourceId, neighborId, "RELATED_TO", weight)));

            derivedSimilarNeighbors(sourceId).forEach((neighborId, weight) -> {
                if (!bySource.containsKey(neighborId)) {
                    bySource.put(neighborId, neighborRow(sourceId, neighborId, "SEMANTICALLY_SIMILAR", weight));
                }
            });

            List<Map<String, Object>> candidates = new ArrayList<>(bySource.values());
            candidates.sort(Comparator.<Map<String, Object>>comparingDouble(r -> -((Double) r.get("weight")))
                .thenComparing(r -> (String) r.get("entity_id")));
            rows.addAll(candidates.subList(0, Math.min(limitPerNode, candidates.size())));
        }
        return rows;
    }

    private Map<String, Double> derivedSimilarNeighbors(String entityId) {
        Map<String, Double> result = new TreeMap<>();
        for (String sectionId : sectionsOf(entityId)) {
            similarSections.getOrDefault(sectionId, Map.of()).forEach((otherSection, weight) -> {
                for (ChunkNode chunk : chunks.values()) {
                    if (!otherSection.equals(chunk.sectionId())) {
                        continue;
                    }
                    for (String neighborId : entitiesByChunk.getOrDefault(chunk.id(), Set.of())) {
                        if (!neighborId.equals(entityId)) {
                            result.merge(neighborId, weight, Math::max);
                        }
                    }
                }
            });
        }
        return result;
    }

    private Set<String> sectionsOf(String entityId) {
        Set<String> result = new LinkedHashSet<>();
        for (String chunkId : chunksByEntity.getOrDefault(entityId, List.of())) {
            String sectionId = chunks.get(chunkId).sectionId();
            if (sectionId != null) {
                result.add(sectionId);
            }
        }
        return result;
    }

    private Map<String, Object> neighborRow(String sourceId, String neighborId, String relation, double weight) {
        EntityNode neighbor = entities.get(neighborId);
        Map<String, Object> row = entityRow(neighbor);
        row.put("source_id", sourceId);
        row.put("relation", relation);
        row.put("weight", weight);
        return row;
    }

    /**
     * Power iteration of personalized PageRank over RELATED_TO edges.
     */
    private List<Map<String, Object>> personalizedRank(List<String> seedIds, double damping, int maxIterations, int topK) {
        List<String> seeds = seedIds.stream().filter(entities::containsKey).distinct().toList();
        if (seeds.isEmpty()) {
            return List.of();
        }
        Map<String, Double> personalization = new HashMap<>();
        seeds.forEach(id -> personalization.put(id, 1.0 / seeds.size()));

        Map<String, Double> rank = new HashMap<>(personalization);
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Map<String, Double> next = new HashMap<>();
            double dangling = 0.0;
            for (Map.Entry<String, Double> entry : rank.entrySet()) {
                Map<String, Double> edges = related.getOrDefault(entry.getKey(), Map.of());
                double total = edges.values().stream().mapToDouble(Double::doubleValue).sum();
                if (total == 0.0) {
                    dangling += entry.getValue();
                    continue;
                }
                for (Map.Entry<String, Double> edge : edges.entrySet()) {
                    next.merge(edge.getKey(), damping * entry.getValue() * edge.getValue() / total, Double::sum);
                }
            }
            double restart = (1.0 - damping) + damping * dangling;
            for (Map.Entry<String, Double> p : personalization.entrySet()) {
                next.merge(p.getKey(), restart * p.getValue(), Double::sum);
            }

            double delta = 0.0;
            Set<String> keys = new LinkedHashSet<>(next.keySet());
            keys.addAll(rank.keySet());
            for (String key : keys) {
                delta += Math.abs(next.getOrDefault(key, 0.0) - rank.getOrDefault(key, 0.0));
            }
            rank = next;
            if (delta < CONVERGENCE_THRESHOLD) {
                break;
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        rank.forEach((id, score) -> {
            if (score > 0.0) {
                Map<String, Object> row = row();
                row.put("entity_id", id);
                row.put("name", entities.get(id).name());
                row.put("score", score);
                rows.add(row);
            }
        });
        return topByScore(rows, "score", topK);
    }

    private List<Map<String, Object>> chunksForEntities(List<String> entityIds, int limitPerEntity) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String entityId : new LinkedHashSet<>(entityIds)) {
            List<String> chunkIds = chunksByEntity.getOrDefault(entityId, List.of());
            for (String chunkId : chunkIds.subList(0, Math.min(limitPerEntity, chunkIds.size()))) {
                Map<String, Object> row = chunkRow(chunks.get(chunkId));
                row.put("entity_id", entityId);
                rows.add(row);
            }
        }
        return rows;
    }

    private List<Map<String, Object>> chunkVectorSearch(float[] query, int topK) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ChunkNode chunk : chunks.values()) {
            float[] embedding = toArray(chunk.embedding());
            if (embedding == null || embedding.length != query.length) {
                continue;
            }
            Map<String, Object> row = chunkRow(chunk);
            row.put("score", EmbeddingUtil.cosineSimilarity(query, embedding));
            rows.add(row);
        }
        return topByScore(rows, "score", topK);
    }

    private List<Map<String, Object>> hubEntities(int topK) {
        List<EntityNode> sorted = new ArrayList<>(entities.values());
        sorted.sort(Comparator.<EntityNode>comparingInt(e -> -degree(e.id())).thenComparing(EntityNode::id));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EntityNode entity : sorted.subList(0, Math.min(topK, sorted.size()))) {
            Map<String, Object> row = row();
            row.put("entity_id", entity.id());
            row.put("name", entity.name());
            row.put("degree", degree(entity.id()));
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> chunkRow(ChunkNode chunk) {
        SectionNode section = chunk.sectionId() != null ? sections.get(chunk.sectionId()) : null;
        DocumentNode document = chunk.documentId() != null ? documents.get(chunk.documentId()) : null;
        Map<String, Object> row = row();
        row.put("chunk_id", chunk.id());
        row.put("text", chunk.text());
        row.put("source", sourceOf(document, chunk));
        row.put("section_title", section != null ? section.title() : null);
        row.put("section_path", section != null && section.path() != null ? section.path() : List.of());
        return row;
    }

    private static String sourceOf(@Nullable DocumentNode document, ChunkNode chunk) {
        if (document == null) {
            return chunk.documentId() != null ? chunk.documentId() : "unknown";
        }
        if (document.title() != null && !document.title().isBlank()) {
            return document.title();
        }
        return document.url() != null ? document.url() : document.id();
    }

    private Map<String, Object> entityRow(EntityNode entity) {
        Map<String, Object> row = row();
        row.put("entity_id", entity.id());
        row.put("name", entity.name());
        row.put("embedding", toArray(entity.embedding()));
        return row;
    }

    private Map<String, Object> row() {
        Map<String, Object> row = new HashMap<>();
        row.put(TenantScopedStatement.GROUP_ID, groupId);
        return row;
    }

    private int degree(String entityId) {
        return related.getOrDefault(entityId, Map.of()).size();
    }

    private static List<Map<String, Object>> topByScore(List<Map<String, Object>> rows, String key, int topK) {
        rows.sort(Comparator.<Map<String, Object>>comparingDouble(r -> -((Number) r.get(key)).doubleValue())
            .thenComparing(r -> String.valueOf(r.getOrDefault("entity_id", r.get("chunk_id")))));
        return new ArrayList<>(rows.subList(0, Math.min(topK, rows.size())));
    }

    @Nullable
    private static float[] toArray(@Nullable List<Float> values) {
        return values == null || values.isEmpty() ? null : EmbeddingUtil.toFloatArray(values);
    }

    private static int intParam(TenantScopedStatement statement, String name) {
        return ((Number) statement.param(name)).intValue();
    }

    private void requireEntity(String id) {
        if (!entities.containsKey(id)) {
            throw new IllegalStateException("Edge references entity '" + id + "' outside tenant " + groupId);
        }
    }

    private void requireChunk(String id) {
        if (!chunks.containsKey(id)) {
            throw new IllegalStateException("Edge references chunk '" + id + "' outside tenant " + groupId);
        }
    }

    private void requireSection(String id) {
        if (!sections.containsKey(id)) {
            throw new IllegalStateException("Edge references section '" + id + "' outside tenant " + groupId);
        }
    }
}
