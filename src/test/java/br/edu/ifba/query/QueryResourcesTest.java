package br.edu.ifba.query;

import br.edu.ifba.graphrag.FakeEmbeddingFunction;
import br.edu.ifba.llm.ChatMessage;
import br.edu.ifba.llm.EmbeddingRequest;
import br.edu.ifba.llm.EmbeddingResponse;
import br.edu.ifba.llm.LlmChatClient;
import br.edu.ifba.llm.LlmChatRequest;
import br.edu.ifba.llm.LlmChatResponse;
import br.edu.ifba.llm.LlmEmbeddingClient;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@QuarkusTest
class QueryResourcesTest {

    private static final String PAYMENT_TERMS = "{\"query\": \"What are the payment terms?\"}";

    @InjectMock
    @RestClient
    LlmChatClient chatClient;

    @InjectMock
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @BeforeEach
    void setUp() {
        when(embeddingClient.embed(any())).thenAnswer(invocation -> {
            final EmbeddingRequest request = invocation.getArgument(0);
            final List<EmbeddingResponse.Embedding> data = new ArrayList<>();
            for (int i = 0; i < request.input().size(); i++) {
                final List<Double> vector = new ArrayList<>();
                for (float value : FakeEmbeddingFunction.vector(request.input().get(i))) {
                    vector.add((double) value);
                }
                data.add(new EmbeddingResponse.Embedding(vector, i));
            }
            return new EmbeddingResponse("test-embedding", data);
        });
        when(chatClient.chat(any())).thenAnswer(invocation -> {
            final LlmChatRequest request = invocation.getArgument(0);
            final String user = request.messages().get(request.messages().size() - 1).content();
            final String content = user.contains("Evidence:")
                ? "Invoices are payable within thirty days [1], by wire transfer [2], with interest on late payments [3]."
                : "[]";
            return chatResponse(content);
        });
    }

    private static LlmChatResponse chatResponse(final String content) {
        return new LlmChatResponse("chatcmpl-test", "test-model",
            List.of(new LlmChatResponse.Choice(0, new ChatMessage("assistant", content), "stop")),
            new LlmChatResponse.Usage(100, 20, 120));
    }

    @Nested
    @DisplayName("POST /query")
    class Query {

        @Test
        @DisplayName("answers with citations from two sections of one document")
        void answersWithCitations() {
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme")
                .body(PAYMENT_TERMS)
            .when()
                .post("/query")
            .then()
                .statusCode(200)
                .body("route_used", equalTo("local-graph-search"))
                .body("answer", containsString("thirty days [1]"))
                .body("citations.size()", greaterThan(1))
                .body("citations.source", everyItem(equalTo("Master Services Agreement")))
                .body("citations.section", hasItems(
                    "Master Services Agreement > Payment",
                    "Master Services Agreement > Payment > Late Fees"))
                .body("confidence", greaterThan(0.5f))
                .body("provisional", equalTo(false));
        }

        @Test
        @DisplayName("only the requesting tenant's documents are cited")
        void tenantIsolation() {
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "globex")
                .body(PAYMENT_TERMS)
            .when()
                .post("/query")
            .then()
                .statusCode(200)
                .body("citations.chunk_id", everyItem(startsWith("g-")))
                .body("citations.source", everyItem(equalTo("Globex Supply Contract")))
                .body("answer", not(containsString("[2]")));
        }

        @Test
        @DisplayName("a simple fact question under high-assurance is answered by local graph search")
        void profileRespected() {
            // classified as direct-vector-lookup, which high-assurance does not permit
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme")
                .body("{\"query\": \"What is the payment terms clause?\", \"profile\": \"high-assurance\"}")
            .when()
                .post("/query")
            .then()
                .statusCode(200)
                .body("route_used", equalTo("local-graph-search"))
                .body("citations", not(empty()));
        }

        @Test
        @DisplayName("a failing model yields a provisional extractive answer")
        void modelFailure() {
            when(chatClient.chat(any())).thenThrow(new IllegalStateException("model overloaded"));

            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme")
                .body(PAYMENT_TERMS)
            .when()
                .post("/query")
            .then()
                .statusCode(200)
                .body("provisional", equalTo(true))
                .body("citations", not(empty()))
                .body("answer", containsString("[1]"));
        }

        @Test
        @DisplayName("rejects requests without a tenant header")
        void missingTenant() {
            given()
                .contentType(ContentType.JSON)
                .body(PAYMENT_TERMS)
            .when()
                .post("/query")
            .then()
                .statusCode(401)
                .body("detail", containsString(QueryResources.TENANT_HEADER));
        }

        @Test
        @DisplayName("rejects a malformed tenant id")
        void invalidTenant() {
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme corp!")
                .body(PAYMENT_TERMS)
            .when()
                .post("/query")
            .then()
                .statusCode(400);
        }

        @Test
        @DisplayName("rejects an unknown profile")
        void unknownProfile() {
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme")
                .body("{\"query\": \"What are the payment terms?\", \"profile\": \"reckless\"}")
            .when()
                .post("/query")
            .then()
                .statusCode(400)
                .body("detail", containsString("reckless"));
        }

        @Test
        @DisplayName("rejects a blank query")
        void blankQuery() {
            given()
                .contentType(ContentType.JSON)
                .header(QueryResources.TENANT_HEADER, "acme")
                .body("{\"query\": \"   \"}")
            .when()
                .post("/query")
            .then()
                .statusCode(400);
        }
    }

    @Test
    @DisplayName("GET /query/profiles lists the configured profiles")
    void profiles() {
        given()
        .when()
            .get("/query/profiles")
        .then()
            .statusCode(200)
            .body("version", equalTo("2024.06.1"))
            .body("profiles.name", hasItems("default", "high-assurance", "speed-critical"))
            .body("profiles.find { it.name == 'high-assurance' }.allowed_routes",
                not(hasItem("direct-vector-lookup")))
            .body("profiles.find { it.name == 'speed-critical' }.allowed_routes",
                not(hasItem("multi-hop-discovery")));
    }
}
