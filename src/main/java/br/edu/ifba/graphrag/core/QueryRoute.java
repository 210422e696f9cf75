package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Retrieval routes. The set is closed: every route has exactly one executor.
 */
public enum QueryRoute {

    /**
     * Nearest chunks by embedding similarity. Requires the vector index.
     */
    DIRECT_VECTOR_LOOKUP("direct-vector-lookup"),

    /**
     * Seed resolution followed by a short graph trace around named entities.
     */
    LOCAL_GRAPH_SEARCH("local-graph-search"),

    /**
     * Answers broad questions from the best connected entities of the tenant.
     */
    GLOBAL_SUMMARY_SEARCH("global-summary-search"),

    /**
     * Decomposes the question and traces every sub-question concurrently.
     */
    MULTI_HOP_DISCOVERY("multi-hop-discovery");

    private final String wireName;

    QueryRoute(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @NotNull
    public String wireName() {
        return wireName;
    }

    /**
     * The next more general route tried when this one produces no evidence.
     *
     * @return the fallback route, or null when this route is the most general one
     */
    @Nullable
    public QueryRoute moreGeneral() {
        return switch (this) {
            case DIRECT_VECTOR_LOOKUP, MULTI_HOP_DISCOVERY -> LOCAL_GRAPH_SEARCH;
            case LOCAL_GRAPH_SEARCH -> GLOBAL_SUMMARY_SEARCH;
            case GLOBAL_SUMMARY_SEARCH -> null;
        };
    }

    @JsonCreator
    @NotNull
    public static QueryRoute fromWireName(@NotNull String value) {
        for (QueryRoute route : values()) {
            if (route.wireName.equalsIgnoreCase(value.trim()) || route.name().equalsIgnoreCase(value.trim())) {
                return route;
            }
        }
        throw new IllegalArgumentException("Unknown route: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
