package br.edu.ifba.query;

import br.edu.ifba.graphrag.core.Citation;
import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryRoute;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QueryResponse(
    @JsonProperty("route_used") QueryRoute routeUsed,
    String answer,
    List<Citation> citations,
    double confidence,
    boolean provisional,
    boolean degraded
) {
    public static QueryResponse from(final GraphRagAnswer answer) {
        return new QueryResponse(
            answer.routeUsed(),
            answer.answer(),
            answer.citations(),
            answer.confidence(),
            answer.provisional(),
            answer.degraded());
    }
}
