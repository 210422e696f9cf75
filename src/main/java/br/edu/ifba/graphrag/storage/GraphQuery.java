package br.edu.ifba.graphrag.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Named, read-only statements the query pipeline issues against the knowledge graph.
 *
 * <p>Every statement filters on {@code $group_id} and returns a single map column whose
 * keys always include {@code group_id}, so the gateway can verify tenant ownership of each
 * row. {@code MENTIONS} edges are only followed to reach chunks, never as topical hops.</p>
 */
public enum GraphQuery {

    MATCH_EXACT_NAME(
        Set.of("mentions"), null,
        "UNWIND $mentions AS m "
            + "MATCH (e:Entity) WHERE e.group_id = $group_id AND toLower(e.name) = m "
            + "RETURN {mention: m, entity_id: e.id, name: e.name, matched: e.name, group_id: e.group_id}"),

    MATCH_ALIAS(
        Set.of("mentions"), null,
        "UNWIND $mentions AS m "
            + "MATCH (e:Entity) WHERE e.group_id = $group_id "
            + "UNWIND coalesce(e.aliases, []) AS a "
            + "WITH m, e, a WHERE toLower(a) = m "
            + "RETURN {mention: m, entity_id: e.id, name: e.name, matched: a, group_id: e.group_id}"),

    MATCH_FIELD_KEY(
        Set.of("mentions"), null,
        "UNWIND $mentions AS m "
            + "MATCH (k:KeyValuePair)-[:SIMILAR_TO]->(e:Entity) "
            + "WHERE k.group_id = $group_id AND e.group_id = $group_id AND toLower(k.key) = m "
            + "RETURN {mention: m, entity_id: e.id, name: e.name, matched: k.key, group_id: e.group_id}"),

    MATCH_SUBSTRING(
        Set.of("mentions"), null,
        "UNWIND $mentions AS m "
            + "MATCH (e:Entity) WHERE e.group_id = $group_id "
            + "AND (toLower(e.name) CONTAINS m OR m CONTAINS toLower(e.name)) "
            + "RETURN {mention: m, entity_id: e.id, name: e.name, matched: e.name, group_id: e.group_id}"),

    ENTITY_CATALOG(
        Set.of("limit"), null,
        "MATCH (e:Entity) WHERE e.group_id = $group_id "
            + "RETURN {entity_id: e.id, name: e.name, embedding: e.embedding, "
            + "degree: coalesce(e.degree, 0), group_id: e.group_id} "
            + "ORDER BY e.id LIMIT $limit"),

    ENTITY_VECTOR_SEARCH(
        Set.of("embedding", "top_k"), GraphCapability.VECTOR_INDEX,
        "CALL db.index.vector.queryNodes('entity_embedding', $top_k, $embedding) YIELD node, score "
            + "WHERE node.group_id = $group_id "
            + "RETURN {entity_id: node.id, name: node.name, score: score, group_id: node.group_id}"),

    ENTITIES_BY_ID(
        Set.of("entity_ids"), null,
        "MATCH (e:Entity) WHERE e.group_id = $group_id AND e.id IN $entity_ids "
            + "RETURN {entity_id: e.id, name: e.name, embedding: e.embedding, group_id: e.group_id}"),

    /**
     * RELATED_TO neighbors plus entities mentioned in semantically similar sections, one row
     * per (source, neighbor) with RELATED_TO preferred, then the strongest edge. The per-node
     * limit applies to both kinds together, heaviest first.
     */
    NEIGHBORS_BATCH(
        Set.of("entity_ids", "limit_per_node"), null,
        "MATCH (e:Entity) WHERE e.group_id = $group_id AND e.id IN $entity_ids "
            + "OPTIONAL MATCH (e)-[r:RELATED_TO]-(n:Entity) WHERE n.group_id = $group_id AND n.id <> e.id "
            + "WITH e, collect({entity_id: n.id, name: n.name, embedding: n.embedding, relation: 'RELATED_TO', "
            + "weight: coalesce(r.weight, 1.0), priority: 0, group_id: n.group_id}) AS related "
            + "OPTIONAL MATCH (e)<-[:MENTIONS]-(:Chunk)-[:IN_SECTION]->(s:Section)"
            + "-[sim:SEMANTICALLY_SIMILAR]-(s2:Section)<-[:IN_SECTION]-(:Chunk)-[:MENTIONS]->(m:Entity) "
            + "WHERE s.group_id = $group_id AND s2.group_id = $group_id AND m.group_id = $group_id "
            + "AND m.id <> e.id "
            + "WITH e, related, collect({entity_id: m.id, name: m.name, embedding: m.embedding, "
            + "relation: 'SEMANTICALLY_SIMILAR', weight: sim.weight, priority: 1, group_id: m.group_id}) AS similar "
            + "UNWIND related + similar AS candidate "
            + "WITH e, candidate WHERE candidate.entity_id IS NOT NULL "
            + "ORDER BY candidate.priority, candidate.weight DESC "
            + "WITH e, candidate.entity_id AS neighbor_id, head(collect(candidate)) AS best "
            + "ORDER BY best.weight DESC, neighbor_id "
            + "WITH e, collect(best)[0..$limit_per_node] AS kept "
            + "UNWIND kept AS row "
            + "RETURN {source_id: e.id, entity_id: row.entity_id, name: row.name, embedding: row.embedding, "
            + "relation: row.relation, weight: row.weight, group_id: row.group_id}"),

    NATIVE_PERSONALIZED_RANK(
        Set.of("seed_ids", "damping", "max_iterations", "top_k"), GraphCapability.NATIVE_RANKING,
        "CALL gds.pageRank.stream({sourceNodes: $seed_ids, dampingFactor: $damping, "
            + "maxIterations: $max_iterations, groupId: $group_id}) YIELD nodeId, score "
            + "MATCH (e:Entity) WHERE id(e) = nodeId AND e.group_id = $group_id "
            + "RETURN {entity_id: e.id, name: e.name, score: score, group_id: e.group_id} "
            + "ORDER BY score DESC LIMIT $top_k"),

    /**
     * Section and document are optional: a chunk outside any section is still evidence.
     * The document is the one named by the chunk's {@code document_id}.
     */
    CHUNKS_FOR_ENTITIES(
        Set.of("entity_ids", "limit_per_entity"), null,
        "MATCH (e:Entity)<-[:MENTIONS]-(c:Chunk) "
            + "WHERE e.group_id = $group_id AND c.group_id = $group_id AND e.id IN $entity_ids "
            + "OPTIONAL MATCH (c)-[:IN_SECTION]->(s:Section) WHERE s.group_id = $group_id "
            + "OPTIONAL MATCH (d:Document) WHERE d.group_id = $group_id AND d.id = c.document_id "
            + "WITH e, c, s, d ORDER BY c.ordinal, c.id "
            + "WITH e, collect({entity_id: e.id, chunk_id: c.id, text: c.text, "
            + "source: coalesce(d.title, d.url, d.id, c.document_id, 'unknown'), section_title: s.title, "
            + "section_path: coalesce(s.path, []), group_id: c.group_id})[0..$limit_per_entity] AS rows "
            + "UNWIND rows AS row RETURN row"),

    CHUNK_VECTOR_SEARCH(
        Set.of("embedding", "top_k"), GraphCapability.VECTOR_INDEX,
        "CALL db.index.vector.queryNodes('chunk_embedding', $top_k, $embedding) YIELD node, score "
            + "WHERE node.group_id = $group_id "
            + "OPTIONAL MATCH (node)-[:IN_SECTION]->(s:Section) WHERE s.group_id = $group_id "
            + "OPTIONAL MATCH (d:Document) WHERE d.group_id = $group_id AND d.id = node.document_id "
            + "RETURN {chunk_id: node.id, text: node.text, "
            + "source: coalesce(d.title, d.url, d.id, node.document_id, 'unknown'), "
            + "section_title: s.title, section_path: coalesce(s.path, []), score: score, "
            + "group_id: node.group_id}"),

    HUB_ENTITIES(
        Set.of("top_k"), null,
        "MATCH (e:Entity) WHERE e.group_id = $group_id "
            + "RETURN {entity_id: e.id, name: e.name, degree: coalesce(e.degree, 0), group_id: e.group_id} "
            + "ORDER BY coalesce(e.degree, 0) DESC, e.id LIMIT $top_k");

    private final Set<String> requiredParams;
    private final GraphCapability requiredCapability;
    private final String cypher;

    GraphQuery(Set<String> requiredParams, GraphCapability requiredCapability, String cypher) {
        this.requiredParams = requiredParams;
        this.requiredCapability = requiredCapability;
        this.cypher = cypher;
    }

    @NotNull
    public Set<String> requiredParams() {
        return requiredParams;
    }

    /**
     * @return the capability the store must offer to run this statement, or null
     */
    @Nullable
    public GraphCapability requiredCapability() {
        return requiredCapability;
    }

    @NotNull
    public String cypher() {
        return cypher;
    }
}
