package br.edu.ifba.query;

import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.routing.RouteProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ProfilesResponse(String version, List<Profile> profiles) {

    public record Profile(
        String name,
        String description,
        @JsonProperty("allowed_routes") List<QueryRoute> allowedRoutes
    ) {
    }

    public static ProfilesResponse from(final String version, final Map<String, RouteProfile> profiles) {
        return new ProfilesResponse(version, profiles.values().stream()
            .map(p -> new Profile(p.name(), p.description(), List.copyOf(p.allowedRoutes())))
            .toList());
    }
}
