package br.edu.ifba.graphrag.query;

import br.edu.ifba.exception.KnowledgeGraphUnavailableException;
import br.edu.ifba.exception.TenantIsolationViolationException;
import br.edu.ifba.graphrag.ScriptedCompletion;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.Citation;
import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.routing.QueryRouter;
import br.edu.ifba.graphrag.routing.RouteProfile;
import br.edu.ifba.graphrag.synthesis.EvidenceCollector;
import br.edu.ifba.graphrag.synthesis.Synthesizer;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryOrchestratorTest {

    private static final RouteProfile DEFAULT = new RouteProfile("default", "all routes",
        EnumSet.allOf(QueryRoute.class));
    private static final RouteProfile NO_GLOBAL = new RouteProfile("no-global", "",
        EnumSet.of(QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH));

    private static final String DIRECT_QUERY = "What is the notice period?";

    private final Synthesizer synthesizer = new Synthesizer(new EvidenceCollector(TestGraphs.gateway()),
        new ScriptedCompletion(), Runnable::run);
    private final List<QueryRoute> executed = new ArrayList<>();
    private final Map<QueryRoute, Supplier<CompletableFuture<GraphRagAnswer>>> behaviour =
        new EnumMap<>(QueryRoute.class);

    private QueryOrchestrator orchestrator() {
        final List<RouteExecutor> executors = new ArrayList<>();
        for (QueryRoute route : QueryRoute.values()) {
            executors.add(new StubExecutor(route));
        }
        return new QueryOrchestrator(new QueryRouter(TestGraphs.gateway()), executors);
    }

    private static GraphRagAnswer answered(QueryRoute route) {
        return new GraphRagAnswer(route, "Thirty days [1].",
            List.of(new Citation(1, "Master Services Agreement", "Payment", "c-payment-1", "Payment terms")),
            0.8, false, false);
    }

    private GraphRagAnswer run(String query, RouteProfile profile) {
        return orchestrator().execute(TestGraphs.context(query), profile).join();
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("the selected route answers when it finds evidence")
        void selectedRouteAnswers() {
            behaviour.put(QueryRoute.DIRECT_VECTOR_LOOKUP,
                () -> CompletableFuture.completedFuture(answered(QueryRoute.DIRECT_VECTOR_LOOKUP)));

            final GraphRagAnswer answer = run(DIRECT_QUERY, DEFAULT);

            assertEquals(QueryRoute.DIRECT_VECTOR_LOOKUP, answer.routeUsed());
            assertEquals(List.of(QueryRoute.DIRECT_VECTOR_LOOKUP), executed);
        }

        @Test
        @DisplayName("the answer names the more general route that produced it")
        void fallbackIsReported() {
            behaviour.put(QueryRoute.LOCAL_GRAPH_SEARCH,
                () -> CompletableFuture.completedFuture(answered(QueryRoute.LOCAL_GRAPH_SEARCH)));

            final GraphRagAnswer answer = run(DIRECT_QUERY, DEFAULT);

            assertEquals(QueryRoute.LOCAL_GRAPH_SEARCH, answer.routeUsed());
            assertEquals(List.of(QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH), executed);
        }

        @Test
        @DisplayName("a recoverable failure moves on to the next route")
        void recoverableFailure() {
            behaviour.put(QueryRoute.DIRECT_VECTOR_LOOKUP,
                () -> CompletableFuture.failedFuture(new IllegalStateException("index offline")));
            behaviour.put(QueryRoute.LOCAL_GRAPH_SEARCH, () -> {
                throw new IllegalStateException("thrown before returning a future");
            });
            behaviour.put(QueryRoute.GLOBAL_SUMMARY_SEARCH,
                () -> CompletableFuture.completedFuture(answered(QueryRoute.GLOBAL_SUMMARY_SEARCH)));

            final GraphRagAnswer answer = run(DIRECT_QUERY, DEFAULT);

            assertEquals(QueryRoute.GLOBAL_SUMMARY_SEARCH, answer.routeUsed());
            assertEquals(3, executed.size());
        }

        @Test
        @DisplayName("routes the profile forbids are skipped")
        void forbiddenFallbackSkipped() {
            final GraphRagAnswer answer = run(DIRECT_QUERY, NO_GLOBAL);

            assertEquals(List.of(QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH), executed);
            assertFalse(answer.hasEvidence());
        }

        @Test
        @DisplayName("without evidence anywhere the answer names the selected route")
        void insufficientEvidence() {
            behaviour.put(QueryRoute.GLOBAL_SUMMARY_SEARCH, () -> CompletableFuture.completedFuture(
                GraphRagAnswer.insufficientEvidence(QueryRoute.GLOBAL_SUMMARY_SEARCH, true)));

            final GraphRagAnswer answer = run(DIRECT_QUERY, DEFAULT);

            assertEquals(GraphRagAnswer.INSUFFICIENT_EVIDENCE, answer.answer());
            assertEquals(QueryRoute.DIRECT_VECTOR_LOOKUP, answer.routeUsed());
            assertTrue(answer.citations().isEmpty());
            assertTrue(answer.degraded());
        }
    }

    @Nested
    @DisplayName("Fatal failures")
    class Fatal {

        @Test
        @DisplayName("a tenant violation aborts without trying other routes")
        void tenantViolation() {
            behaviour.put(QueryRoute.DIRECT_VECTOR_LOOKUP, () -> CompletableFuture.failedFuture(
                new TenantIsolationViolationException("acme", "globex", "CHUNK_VECTOR_SEARCH")));

            final CompletionException error = assertThrows(CompletionException.class,
                () -> run(DIRECT_QUERY, DEFAULT));

            assertInstanceOf(TenantIsolationViolationException.class, error.getCause());
            assertEquals(List.of(QueryRoute.DIRECT_VECTOR_LOOKUP), executed);
        }

        @Test
        @DisplayName("an unreachable store aborts without trying other routes")
        void storeUnavailable() {
            behaviour.put(QueryRoute.LOCAL_GRAPH_SEARCH, () -> CompletableFuture.failedFuture(
                new KnowledgeGraphUnavailableException("connection refused")));

            final CompletionException error = assertThrows(CompletionException.class,
                () -> run("Who is Contoso Ltd?", DEFAULT));

            assertInstanceOf(KnowledgeGraphUnavailableException.class, error.getCause());
            assertEquals(List.of(QueryRoute.LOCAL_GRAPH_SEARCH), executed);
        }
    }

    private class StubExecutor extends RouteExecutor {

        private final QueryRoute route;

        StubExecutor(QueryRoute route) {
            super(QueryOrchestratorTest.this.synthesizer);
            this.route = route;
        }

        @Override
        public @NotNull QueryRoute route() {
            return route;
        }

        @Override
        public CompletableFuture<GraphRagAnswer> execute(@NotNull QueryContext context) {
            executed.add(route);
            final Supplier<CompletableFuture<GraphRagAnswer>> supplier = behaviour.get(route);
            if (supplier == null) {
                return CompletableFuture.completedFuture(GraphRagAnswer.insufficientEvidence(route, false));
            }
            return supplier.get();
        }
    }
}
