package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvidenceCollectorTest {

    private final EvidenceCollector collector = new EvidenceCollector(TestGraphs.gateway());

    @Test
    @DisplayName("chunks follow entity rank and carry their provenance")
    void rankOrder() {
        final List<RankedEntity> entities = List.of(
            new RankedEntity("e-northwind", "Northwind Holdings", 1.0),
            new RankedEntity("e-payment-terms", "Payment Terms", 0.5));

        final List<Chunk> chunks = collector.collect(entities, TestGraphs.param(TestGraphs.ACME).build()).join();

        assertEquals(List.of("c-northwind", "c-payment-1", "c-payment-2", "c-late-fees"),
            chunks.stream().map(Chunk::id).toList());
        final Chunk first = chunks.get(0);
        assertEquals("Master Services Agreement", first.source());
        assertEquals("Master Services Agreement > Parties", first.sectionLabel());
        assertEquals(Set.of("e-northwind"), first.entityIds());
    }

    @Test
    @DisplayName("per-entity limit bounds the evidence")
    void limitPerEntity() {
        final QueryParam param = TestGraphs.param(TestGraphs.ACME).limitPerEntity(1).build();

        final List<Chunk> chunks = collector.collect(
            List.of(new RankedEntity("e-payment-terms", "Payment Terms", 1.0)), param).join();

        assertEquals(List.of("c-payment-1"), chunks.stream().map(Chunk::id).toList());
    }

    @Test
    @DisplayName("a chunk reached through two entities appears once")
    void sharedChunk() {
        final List<RankedEntity> entities = List.of(
            new RankedEntity("e-contoso", "Contoso Ltd", 1.0),
            new RankedEntity("e-fabrikam", "Fabrikam Inc", 0.9));

        final List<Chunk> chunks = collector.collect(entities, TestGraphs.param(TestGraphs.ACME).build()).join();

        assertEquals(chunks.size(), chunks.stream().map(Chunk::id).distinct().count());
        final Chunk parties = chunks.stream().filter(c -> c.id().equals("c-parties")).findFirst().orElseThrow();
        assertEquals(List.of("e-contoso", "e-fabrikam"), List.copyOf(parties.entityIds()));
    }

    @Test
    @DisplayName("another tenant's chunks are never returned")
    void tenantScoped() {
        final List<Chunk> chunks = collector.collect(
            List.of(new RankedEntity("e-payment-terms", "Payment Terms", 1.0)),
            TestGraphs.param(TestGraphs.GLOBEX).build()).join();

        assertTrue(chunks.isEmpty());
    }

    @Test
    @DisplayName("deduplication drops repeated ids and normalized text and is idempotent")
    void deduplicate() {
        final List<Chunk> chunks = List.of(
            new Chunk("c1", "Net thirty days.", "A", null, List.of(), null),
            new Chunk("c1", "Something else.", "A", null, List.of(), null),
            new Chunk("c2", "  NET   thirty days. ", "B", null, List.of(), null),
            new Chunk("c3", "Interest applies.", "A", null, List.of(), null));

        final List<Chunk> once = EvidenceCollector.deduplicate(chunks);

        assertEquals(List.of("c1", "c3"), once.stream().map(Chunk::id).toList());
        assertEquals(once, EvidenceCollector.deduplicate(once));
    }

    @Test
    @DisplayName("a dropped duplicate credits its entities to the chunk that is kept")
    void deduplicateMergesEntities() {
        final List<Chunk> chunks = List.of(
            new Chunk("c1", "Net thirty days.", "A", null, List.of(), Set.of("e-acme")),
            new Chunk("c1", "Net thirty days.", "A", null, List.of(), Set.of("e-contoso")),
            new Chunk("c2", "net thirty DAYS.", "A", null, List.of(), Set.of("e-fabrikam")));

        final List<Chunk> once = EvidenceCollector.deduplicate(chunks);

        assertEquals(1, once.size());
        assertEquals(List.of("e-acme", "e-contoso", "e-fabrikam"), List.copyOf(once.get(0).entityIds()));
        assertEquals(once, EvidenceCollector.deduplicate(once));
    }
}
