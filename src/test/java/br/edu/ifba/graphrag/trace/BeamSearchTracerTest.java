package br.edu.ifba.graphrag.trace;

import br.edu.ifba.graphrag.FakeEmbeddingFunction;
import br.edu.ifba.graphrag.RecordingStore;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.storage.impl.GraphSnapshot;
import br.edu.ifba.graphrag.storage.impl.InMemoryKnowledgeGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BeamSearchTracerTest {

    private static final List<RankedEntity> CONTOSO = List.of(new RankedEntity("e-contoso", "Contoso Ltd", 0.9));

    private RecordingStore store;
    private FakeEmbeddingFunction embeddings;
    private BeamSearchTracer tracer;

    @BeforeEach
    void setUp() {
        store = RecordingStore.over(EnumSet.allOf(GraphCapability.class));
        embeddings = new FakeEmbeddingFunction();
        tracer = new BeamSearchTracer(new GraphQueryGateway(store), embeddings);
    }

    private QueryContext context(int beamWidth, int maxHops) {
        return new QueryContext("Who works with Fabrikam?",
            TestGraphs.param(TestGraphs.ACME).beamWidth(beamWidth).maxHops(maxHops).build());
    }

    @Test
    @DisplayName("keeps the best neighbor per hop and stops when no unvisited neighbor remains")
    void followsBestNeighbor() {
        final TraceResult result = tracer.expand(CONTOSO, context(1, 3)).join();

        assertEquals(List.of("e-contoso", "e-fabrikam"), ids(result));
        assertEquals(1.0, result.entities().get(0).score());
        assertEquals(TraceMode.BEAM_SEARCH, result.mode());
        assertEquals(TraceQuality.BEAM, result.quality());
        assertFalse(result.isDegraded());
    }

    @Test
    @DisplayName("issues one neighbor lookup per hop")
    void oneNeighborCallPerHop() {
        tracer.expand(CONTOSO, context(1, 3)).join();

        // hop 1 from the seed, hop 2 from Fabrikam finds only visited entities
        assertEquals(2, store.count(GraphQuery.NEIGHBORS_BATCH));
    }

    @Test
    @DisplayName("embeds the query once and missing neighbor vectors in one batch")
    void batchedEmbeddings() {
        tracer.expand(CONTOSO, context(1, 3)).join();

        assertEquals(2, embeddings.calls().size());
        assertEquals(List.of("Who works with Fabrikam?"), embeddings.calls().get(0));
        assertEquals(List.of("Invoice 1256003"), embeddings.calls().get(1));
    }

    @Test
    @DisplayName("beam width bounds the entities kept per hop")
    void beamWidthBound() {
        final TraceResult result = tracer.expand(CONTOSO, context(2, 1)).join();

        assertEquals(List.of("e-contoso", "e-fabrikam", "e-northwind"), ids(result));
    }

    @Test
    @DisplayName("zero hops returns the seeds only")
    void zeroHops() {
        final TraceResult result = tracer.expand(CONTOSO, context(5, 0)).join();

        assertEquals(List.of("e-contoso"), ids(result));
        assertEquals(0, store.count(GraphQuery.NEIGHBORS_BATCH));
    }

    @Test
    @DisplayName("all statements stay in the requesting tenant")
    void tenantScoped() {
        tracer.expand(CONTOSO, context(3, 3)).join();

        assertTrue(store.statements().stream().allMatch(s -> s.tenant().equals(TestGraphs.ACME)));
    }

    @Test
    @DisplayName("a failed query embedding fails the trace")
    void embeddingFailure() {
        embeddings.failWith(new IllegalStateException("embedding service down"));

        assertThrows(CompletionException.class, () -> tracer.expand(CONTOSO, context(2, 2)).join());
    }

    @Test
    @DisplayName("among equal scores the neighbor reached from more beam members is kept")
    void tieBrokenBySourceCount() {
        final List<Float> sameVector = List.of(1.0f, 0.0f, 0.0f, 0.0f);
        final GraphSnapshot.TenantSnapshot tenant = new GraphSnapshot.TenantSnapshot(
            null, null, null,
            List.of(
                new GraphSnapshot.EntityNode("s-1", "Seed One", null, sameVector),
                new GraphSnapshot.EntityNode("s-2", "Seed Two", null, sameVector),
                new GraphSnapshot.EntityNode("n-a", "Alpha Supplier", null, sameVector),
                new GraphSnapshot.EntityNode("n-b", "Beta Supplier", null, sameVector)),
            null,
            List.of(
                new GraphSnapshot.RelationEdge("s-1", "n-a", 1.0),
                new GraphSnapshot.RelationEdge("s-1", "n-b", 1.0),
                new GraphSnapshot.RelationEdge("s-2", "n-b", 1.0)),
            null, null);
        final InMemoryKnowledgeGraphStore graph = new InMemoryKnowledgeGraphStore(
            new GraphSnapshot(Map.of("acme", tenant)), EnumSet.allOf(GraphCapability.class));
        final BeamSearchTracer tieTracer = new BeamSearchTracer(new GraphQueryGateway(graph), embeddings);
        final List<RankedEntity> seeds = List.of(
            new RankedEntity("s-1", "Seed One", 1.0),
            new RankedEntity("s-2", "Seed Two", 1.0));

        final TraceResult result = tieTracer.expand(seeds, new QueryContext("Contoso suppliers",
            TestGraphs.param(TestGraphs.ACME).beamWidth(1).maxHops(1).build())).join();

        // "n-a" would win on id order alone
        assertTrue(ids(result).contains("n-b"));
        assertFalse(ids(result).contains("n-a"));
    }

    private static List<String> ids(TraceResult result) {
        return result.entities().stream().map(RankedEntity::entityId).toList();
    }
}
