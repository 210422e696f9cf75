package br.edu.ifba.graphrag.routing;

import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryRouterTest {

    private static final RouteProfile DEFAULT = new RouteProfile("default", "all routes",
        EnumSet.allOf(QueryRoute.class));
    private static final RouteProfile HIGH_ASSURANCE = new RouteProfile("high-assurance", "no vector shortcuts",
        EnumSet.of(QueryRoute.LOCAL_GRAPH_SEARCH, QueryRoute.GLOBAL_SUMMARY_SEARCH, QueryRoute.MULTI_HOP_DISCOVERY));
    private static final RouteProfile SPEED = new RouteProfile("speed-critical", "no decomposition",
        EnumSet.of(QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH, QueryRoute.GLOBAL_SUMMARY_SEARCH));

    private final QueryRouter withIndex = new QueryRouter(TestGraphs.gateway(EnumSet.allOf(GraphCapability.class)));
    private final QueryRouter withoutIndex = new QueryRouter(TestGraphs.gateway(EnumSet.noneOf(GraphCapability.class)));

    @Nested
    @DisplayName("Route selection")
    class Selection {

        @Test
        @DisplayName("the classified route is used when permitted and available")
        void classifiedRoute() {
            final RouteDecision decision = withIndex.route("What is the notice period?", DEFAULT);

            assertEquals(QueryRoute.DIRECT_VECTOR_LOOKUP, decision.selected());
            assertFalse(decision.isSubstituted());
        }

        @Test
        @DisplayName("a forbidden route is replaced by local graph search")
        void forbiddenRoute() {
            final RouteDecision decision = withIndex.route("What is the notice period?", HIGH_ASSURANCE);

            assertEquals(QueryRoute.DIRECT_VECTOR_LOOKUP, decision.classified());
            assertEquals(QueryRoute.LOCAL_GRAPH_SEARCH, decision.selected());
            assertTrue(decision.isSubstituted());
            assertNotNull(decision.reason());
        }

        @Test
        @DisplayName("multi-hop questions under speed-critical run as local graph search")
        void speedCritical() {
            final RouteDecision decision = withIndex.route("Who owns Fabrikam Inc? Where is it based?", SPEED);

            assertEquals(QueryRoute.MULTI_HOP_DISCOVERY, decision.classified());
            assertEquals(QueryRoute.LOCAL_GRAPH_SEARCH, decision.selected());
        }

        @Test
        @DisplayName("direct lookup without a vector index falls back to local graph search")
        void noVectorIndex() {
            final RouteDecision decision = withoutIndex.route("What is the notice period?", DEFAULT);

            assertEquals(QueryRoute.LOCAL_GRAPH_SEARCH, decision.selected());
            assertTrue(decision.reason().contains("vector index"));
        }

        @Test
        @DisplayName("selection is deterministic")
        void deterministic() {
            for (int i = 0; i < 5; i++) {
                assertEquals(QueryRoute.LOCAL_GRAPH_SEARCH,
                    withIndex.route("What are the payment terms?", DEFAULT).selected());
            }
        }

        @Test
        @DisplayName("a profile without local search substitutes its first permitted route")
        void substituteWithoutLocal() {
            final RouteProfile globalOnly = new RouteProfile("global-only", "", Set.of(QueryRoute.GLOBAL_SUMMARY_SEARCH));

            assertEquals(QueryRoute.GLOBAL_SUMMARY_SEARCH,
                withIndex.route("What are the payment terms?", globalOnly).selected());
        }
    }

    @Nested
    @DisplayName("Fallback chain")
    class FallbackChain {

        @Test
        @DisplayName("runs from the selected route to the most general one")
        void fullChain() {
            assertEquals(List.of(QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH,
                    QueryRoute.GLOBAL_SUMMARY_SEARCH),
                withIndex.fallbackChain(QueryRoute.DIRECT_VECTOR_LOOKUP, DEFAULT));
            assertEquals(List.of(QueryRoute.MULTI_HOP_DISCOVERY, QueryRoute.LOCAL_GRAPH_SEARCH,
                    QueryRoute.GLOBAL_SUMMARY_SEARCH),
                withIndex.fallbackChain(QueryRoute.MULTI_HOP_DISCOVERY, DEFAULT));
        }

        @Test
        @DisplayName("skips routes the profile forbids")
        void skipsForbidden() {
            final RouteProfile noLocal = new RouteProfile("no-local", "",
                EnumSet.of(QueryRoute.MULTI_HOP_DISCOVERY, QueryRoute.GLOBAL_SUMMARY_SEARCH));

            assertEquals(List.of(QueryRoute.MULTI_HOP_DISCOVERY, QueryRoute.GLOBAL_SUMMARY_SEARCH),
                withIndex.fallbackChain(QueryRoute.MULTI_HOP_DISCOVERY, noLocal));
        }

        @Test
        @DisplayName("the most general route has no fallback")
        void globalIsLast() {
            assertEquals(List.of(QueryRoute.GLOBAL_SUMMARY_SEARCH),
                withIndex.fallbackChain(QueryRoute.GLOBAL_SUMMARY_SEARCH, DEFAULT));
        }
    }
}
