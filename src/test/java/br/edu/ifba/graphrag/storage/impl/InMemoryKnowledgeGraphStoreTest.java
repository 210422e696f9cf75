package br.edu.ifba.graphrag.storage.impl;

import br.edu.ifba.exception.BackendDegradedException;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.TenantId;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.TenantScopedQueryBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKnowledgeGraphStoreTest {

    private InMemoryKnowledgeGraphStore store;

    @BeforeEach
    void setUp() {
        store = TestGraphs.store(EnumSet.allOf(GraphCapability.class));
    }

    private List<GraphRow> run(TenantId tenant, GraphQuery query, Map<String, Object> params) {
        TenantScopedQueryBuilder builder = TenantScopedQueryBuilder.forTenant(tenant).statement(query);
        params.forEach(builder::param);
        return store.query(builder.build()).join();
    }

    @Nested
    @DisplayName("Tenant partitioning")
    class TenantPartitioning {

        @Test
        @DisplayName("entities with the same name resolve to each tenant's own node")
        void sameNameDifferentTenants() {
            final List<GraphRow> acme = run(TestGraphs.ACME, GraphQuery.MATCH_EXACT_NAME,
                Map.of("mentions", List.of("payment terms")));
            final List<GraphRow> globex = run(TestGraphs.GLOBEX, GraphQuery.MATCH_EXACT_NAME,
                Map.of("mentions", List.of("payment terms")));

            assertEquals(List.of("e-payment-terms"), ids(acme, "entity_id"));
            assertEquals(List.of("g-payment-terms"), ids(globex, "entity_id"));
            assertTrue(acme.stream().allMatch(row -> "acme".equals(row.groupId())));
            assertTrue(globex.stream().allMatch(row -> "globex".equals(row.groupId())));
        }

        @Test
        @DisplayName("ids of another tenant are invisible")
        void foreignIdsInvisible() {
            final List<GraphRow> rows = run(TestGraphs.GLOBEX, GraphQuery.CHUNKS_FOR_ENTITIES,
                Map.of("entity_ids", List.of("e-payment-terms"), "limit_per_entity", 10));

            assertTrue(rows.isEmpty());
        }

        @Test
        @DisplayName("an unknown tenant has an empty graph")
        void unknownTenant() {
            final List<GraphRow> rows = run(TenantId.of("initech"), GraphQuery.HUB_ENTITIES, Map.of("top_k", 5));

            assertTrue(rows.isEmpty());
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("relations are undirected and collapse to one edge per pair")
        void undirectedNeighbors() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.NEIGHBORS_BATCH,
                Map.of("entity_ids", List.of("e-fabrikam"), "limit_per_node", 10));

            final Map<String, String> relations = rows.stream()
                .collect(Collectors.toMap(r -> r.getString("entity_id"), r -> r.getString("relation")));
            assertEquals("RELATED_TO", relations.get("e-contoso"));
            assertEquals("RELATED_TO", relations.get("e-northwind"));
            assertEquals(0.9, rows.stream().filter(r -> "e-contoso".equals(r.getString("entity_id")))
                .findFirst().orElseThrow().getDouble("weight", 0.0), 1e-9);
        }

        @Test
        @DisplayName("entities in semantically similar sections are derived neighbors")
        void derivedSimilarityNeighbors() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.NEIGHBORS_BATCH,
                Map.of("entity_ids", List.of("e-northwind"), "limit_per_node", 10));

            final Map<String, String> relations = rows.stream()
                .collect(Collectors.toMap(r -> r.getString("entity_id"), r -> r.getString("relation")));
            assertEquals("RELATED_TO", relations.get("e-fabrikam"));
            assertEquals("SEMANTICALLY_SIMILAR", relations.get("e-invoice"));
        }

        @Test
        @DisplayName("limit_per_node caps related and derived neighbors together, heaviest first")
        void neighborLimitSpansBothKinds() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.NEIGHBORS_BATCH,
                Map.of("entity_ids", List.of("e-northwind"), "limit_per_node", 2));

            assertEquals(List.of("e-fabrikam", "e-contoso"), ids(rows, "entity_id"));
            assertEquals(List.of("RELATED_TO", "SEMANTICALLY_SIMILAR"), ids(rows, "relation"));
        }

        @Test
        @DisplayName("chunks come back with document and section provenance in ordinal order")
        void chunkProvenance() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.CHUNKS_FOR_ENTITIES,
                Map.of("entity_ids", List.of("e-payment-terms"), "limit_per_entity", 10));

            assertEquals(List.of("c-payment-1", "c-payment-2", "c-late-fees"), ids(rows, "chunk_id"));
            assertEquals("Master Services Agreement", rows.get(0).getString("source"));
            assertEquals("Payment", rows.get(0).getString("section_title"));
            assertEquals(List.of("Master Services Agreement", "Payment", "Late Fees"),
                rows.get(2).getStringList("section_path"));
        }

        @Test
        @DisplayName("limit_per_entity bounds the chunks of each entity")
        void chunkLimit() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.CHUNKS_FOR_ENTITIES,
                Map.of("entity_ids", List.of("e-payment-terms"), "limit_per_entity", 2));

            assertEquals(2, rows.size());
        }

        @Test
        @DisplayName("native ranking favours the seed and its neighbourhood")
        void nativeRank() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.NATIVE_PERSONALIZED_RANK,
                Map.of("seed_ids", List.of("e-contoso"), "damping", 0.85, "max_iterations", 30, "top_k", 10));

            assertEquals("e-contoso", rows.get(0).getString("entity_id"));
            assertTrue(ids(rows, "entity_id").contains("e-fabrikam"));
        }

        @Test
        @DisplayName("structured field keys resolve to the linked entity")
        void fieldKeys() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.MATCH_FIELD_KEY,
                Map.of("mentions", List.of("invoice number")));

            assertEquals(List.of("e-invoice"), ids(rows, "entity_id"));
        }
    }

    @Nested
    @DisplayName("Capabilities")
    class Capabilities {

        @Test
        @DisplayName("vector search without the index fails as degraded")
        void vectorSearchWithoutIndex() {
            final InMemoryKnowledgeGraphStore plain = TestGraphs.store(EnumSet.noneOf(GraphCapability.class));
            final var statement = TenantScopedQueryBuilder.forTenant(TestGraphs.ACME)
                .statement(GraphQuery.CHUNK_VECTOR_SEARCH)
                .param("embedding", new float[]{0f, 0f, 1f, 0f})
                .param("top_k", 2)
                .build();

            final CompletionException error = assertThrows(CompletionException.class,
                () -> plain.query(statement).join());
            assertInstanceOf(BackendDegradedException.class, error.getCause());
        }

        @Test
        @DisplayName("vector search ranks chunks by cosine similarity")
        void vectorSearch() {
            final List<GraphRow> rows = run(TestGraphs.ACME, GraphQuery.CHUNK_VECTOR_SEARCH,
                Map.of("embedding", new float[]{0f, 0f, 1f, 0f}, "top_k", 2));

            assertEquals("c-payment-1", rows.get(0).getString("chunk_id"));
            assertEquals(2, rows.size());
        }
    }

    @Test
    @DisplayName("edges pointing outside the tenant are rejected at load time")
    void rejectsCrossTenantEdges() {
        final GraphSnapshot.TenantSnapshot broken = new GraphSnapshot.TenantSnapshot(
            List.of(), List.of(), List.of(),
            List.of(new GraphSnapshot.EntityNode("e-1", "One", List.of(), null)),
            List.of(),
            List.of(new GraphSnapshot.RelationEdge("e-1", "g-foreign", 1.0)),
            List.of(), List.of());

        assertThrows(IllegalStateException.class, () -> new InMemoryKnowledgeGraphStore(
            new GraphSnapshot(Map.of("acme", broken)), EnumSet.noneOf(GraphCapability.class)));
    }

    private static List<String> ids(List<GraphRow> rows, String column) {
        return rows.stream().map(row -> row.getString(column)).toList();
    }
}
