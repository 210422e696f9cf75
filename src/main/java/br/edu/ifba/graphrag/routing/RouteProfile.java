package br.edu.ifba.graphrag.routing;

import br.edu.ifba.graphrag.core.QueryRoute;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named set of routes the router may choose from.
 *
 * @param name          profile name, e.g. {@code high-assurance}
 * @param description   operator-facing description
 * @param allowedRoutes permitted routes, iterated in enumeration order
 */
public record RouteProfile(
        @NotNull String name,
        @NotNull String description,
        @JsonProperty("allowed_routes") @NotNull Set<QueryRoute> allowedRoutes
) {
    public RouteProfile {
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        if (allowedRoutes == null || allowedRoutes.isEmpty()) {
            throw new IllegalArgumentException("Profile '" + name + "' must allow at least one route");
        }
        allowedRoutes = Collections.unmodifiableSet(EnumSet.copyOf(allowedRoutes));
    }

    public boolean permits(@NotNull QueryRoute route) {
        return allowedRoutes.contains(route);
    }

    /**
     * Route used in place of a forbidden one: local graph search when permitted,
     * otherwise the first permitted route in enumeration order.
     */
    @NotNull
    public QueryRoute substituteRoute() {
        if (permits(QueryRoute.LOCAL_GRAPH_SEARCH)) {
            return QueryRoute.LOCAL_GRAPH_SEARCH;
        }
        return allowedRoutes.iterator().next();
    }
}
