package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.FakeEmbeddingFunction;
import br.edu.ifba.graphrag.RecordingStore;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.disambiguation.Disambiguator;
import br.edu.ifba.graphrag.disambiguation.HeuristicMentionExtractor;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.trace.TraceMode;
import br.edu.ifba.graphrag.trace.TraceResult;
import br.edu.ifba.graphrag.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DisambiguatingEvidenceExpanderTest {

    private static final RankedEntity PAYMENT_TERMS = new RankedEntity("e-payment-terms", "Payment Terms", 1.0);

    private RecordingStore store;
    private GraphQueryGateway gateway;
    private FakeEmbeddingFunction embeddings;

    @BeforeEach
    void setUp() {
        store = RecordingStore.over(EnumSet.allOf(GraphCapability.class));
        gateway = new GraphQueryGateway(store);
        embeddings = new FakeEmbeddingFunction();
    }

    private DisambiguatingEvidenceExpander expander(Tracer tracer) {
        return new DisambiguatingEvidenceExpander(new Disambiguator(gateway, embeddings),
            new HeuristicMentionExtractor(), tracer);
    }

    private static List<String> ids(List<RankedEntity> entities) {
        return entities.stream().map(RankedEntity::entityId).toList();
    }

    @Test
    @DisplayName("traces again from the new and the known seeds with a wider beam and one more hop")
    void retracesFromNewSeeds() {
        final List<List<String>> seedsTraced = new ArrayList<>();
        final List<QueryParam> paramsTraced = new ArrayList<>();
        final Tracer recording = new Tracer(gateway, embeddings) {
            @Override
            public CompletableFuture<TraceResult> expand(List<RankedEntity> seeds, TraceMode mode, QueryContext context) {
                seedsTraced.add(ids(seeds));
                paramsTraced.add(context.param());
                return super.expand(seeds, mode, context);
            }
        };
        final QueryContext context = TestGraphs.context("Who guarantees the obligations?");

        final List<RankedEntity> found = expander(recording)
            .expand(List.of("northwind"), List.of(PAYMENT_TERMS), context).join();

        assertEquals(List.of(List.of("e-northwind", "e-payment-terms")), seedsTraced);
        assertEquals(context.param().getBeamWidth() + DisambiguatingEvidenceExpander.BEAM_WIDENING,
            paramsTraced.get(0).getBeamWidth());
        assertEquals(context.param().getMaxHops() + 1, paramsTraced.get(0).getMaxHops());
        assertEquals(context.param().getDeadline(), paramsTraced.get(0).getDeadline());

        assertEquals("e-northwind", found.get(0).entityId());
        assertTrue(ids(found).contains("e-fabrikam"), ids(found).toString());
        assertTrue(store.count(GraphQuery.NEIGHBORS_BATCH) > 0);
    }

    @Test
    @DisplayName("gaps that only resolve to known entities trigger no trace")
    void nothingNew() {
        final List<RankedEntity> found = expander(new Tracer(gateway, embeddings))
            .expand(List.of("payment"), List.of(PAYMENT_TERMS), TestGraphs.context("What are the payment terms?"))
            .join();

        assertTrue(found.isEmpty());
        assertEquals(0, store.count(GraphQuery.NEIGHBORS_BATCH));
    }

    @Test
    @DisplayName("a failed trace still returns the newly resolved seeds")
    void traceFailure() {
        final Tracer failing = new Tracer(gateway, embeddings) {
            @Override
            public CompletableFuture<TraceResult> expand(List<RankedEntity> seeds, TraceMode mode, QueryContext context) {
                return CompletableFuture.failedFuture(new IllegalStateException("neighbor lookup timed out"));
            }
        };

        final List<RankedEntity> found = expander(failing)
            .expand(List.of("northwind"), List.of(PAYMENT_TERMS), TestGraphs.context("Who guarantees the obligations?"))
            .join();

        assertEquals(List.of("e-northwind"), ids(found));
    }
}
