package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.Citation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationValidatorTest {

    private CitationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CitationRegistry();
        registry.register(new Chunk("c1", "Invoices are payable within thirty days.", "MSA", "Payment",
            List.of("MSA", "Payment"), null));
        registry.register(new Chunk("c2", "Late payments accrue interest.", "MSA", "Late Fees", List.of(), null));
    }

    @Nested
    @DisplayName("stripInvalidMarkers")
    class StripInvalidMarkers {

        @Test
        @DisplayName("keeps an answer with only valid markers unchanged")
        void validUntouched() {
            final String answer = "Thirty days [1]; interest applies [2][1].";

            assertSame(answer, CitationValidator.stripInvalidMarkers(answer, registry));
        }

        @Test
        @DisplayName("removes unknown markers and tidies the spacing they leave")
        void removesUnknown() {
            final String cleaned = CitationValidator.stripInvalidMarkers(
                "Thirty days [1] [3], with interest [0] applied [2].", registry);

            assertEquals("Thirty days [1], with interest applied [2].", cleaned);
        }

        @Test
        @DisplayName("every remaining marker names a registered citation")
        void onlyRegisteredRemain() {
            final String cleaned = CitationValidator.stripInvalidMarkers("[4] A [12] B [2] C [999].", registry);

            assertTrue(CitationValidator.referencedIds(cleaned).stream().allMatch(registry::contains));
            assertEquals(Set.of(2), CitationValidator.referencedIds(cleaned));
        }
    }

    @Nested
    @DisplayName("CitationRegistry")
    class Registry {

        @Test
        @DisplayName("a chunk keeps its id when registered again")
        void stableIds() {
            final Citation again = registry.register(new Chunk("c1", "Invoices are payable within thirty days.",
                "MSA", "Payment", List.of("MSA", "Payment"), null));

            assertEquals(1, again.id());
            assertEquals(2, registry.size());
            assertEquals("MSA > Payment", again.section());
            assertEquals("Late Fees", registry.get(2).section());
            assertNull(registry.get(3));
        }

        @Test
        @DisplayName("previews are cut at one hundred characters")
        void preview() {
            final String text = "x".repeat(150);

            assertEquals("x".repeat(100) + "...", CitationRegistry.preview(text));
            assertEquals("short", CitationRegistry.preview("  short  "));
        }
    }
}
