package br.edu.ifba.graphrag.trace;

import br.edu.ifba.exception.TenantIsolationViolationException;
import br.edu.ifba.graphrag.FakeEmbeddingFunction;
import br.edu.ifba.graphrag.RecordingStore;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TracerTest {

    private static final List<RankedEntity> CONTOSO = List.of(new RankedEntity("e-contoso", "Contoso Ltd", 1.0));

    @Test
    @DisplayName("a failed beam search falls back to approximate ranking")
    void beamFailureFallsBack() {
        final FakeEmbeddingFunction embeddings = new FakeEmbeddingFunction();
        embeddings.failWith(new IllegalStateException("embedding service down"));
        final GraphQueryGateway gateway = new GraphQueryGateway(RecordingStore.over(EnumSet.noneOf(GraphCapability.class)));
        final Tracer tracer = new Tracer(gateway, embeddings);

        final TraceResult result = tracer.expand(CONTOSO, TraceMode.BEAM_SEARCH, TestGraphs.context("Contoso partners")).join();

        assertEquals(TraceMode.APPROXIMATE_RANK, result.mode());
        assertTrue(result.isDegraded());
        assertEquals("e-contoso", result.entities().get(0).entityId());
    }

    @Test
    @DisplayName("tenant violations abort instead of falling back")
    void violationAborts() {
        final RecordingStore store = RecordingStore.over(EnumSet.noneOf(GraphCapability.class))
            .failing(GraphQuery.NEIGHBORS_BATCH,
                new TenantIsolationViolationException("acme", "globex", "NEIGHBORS_BATCH"));
        final Tracer tracer = new Tracer(new GraphQueryGateway(store), new FakeEmbeddingFunction());
        final QueryContext context = TestGraphs.context("Contoso partners");

        final CompletionException error = assertThrows(CompletionException.class,
            () -> tracer.expand(CONTOSO, TraceMode.BEAM_SEARCH, context).join());
        assertInstanceOf(TenantIsolationViolationException.class, error.getCause());
    }

    @Test
    @DisplayName("no seeds yields an empty result in the requested mode")
    void noSeeds() {
        final Tracer tracer = new Tracer(TestGraphs.gateway(), new FakeEmbeddingFunction());

        final TraceResult result = tracer.expand(List.of(), TraceMode.BEAM_SEARCH, TestGraphs.context("anything")).join();

        assertTrue(result.isEmpty());
        assertEquals(TraceMode.BEAM_SEARCH, result.mode());
    }
}
