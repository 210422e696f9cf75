package br.edu.ifba.graphrag.routing;

import br.edu.ifba.graphrag.core.QueryRoute;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the route for a query under a profile.
 *
 * <p>The classified route is replaced when the profile forbids it, and again when the store
 * lacks the index it needs. Both substitutions are deterministic and recorded in the
 * {@link RouteDecision}.</p>
 */
@ApplicationScoped
public class QueryRouter {

    private static final Logger logger = LoggerFactory.getLogger(QueryRouter.class);

    private final QueryClassifier classifier;
    private final GraphQueryGateway gateway;

    @Inject
    public QueryRouter(GraphQueryGateway gateway) {
        this(new QueryClassifier(), gateway);
    }

    public QueryRouter(@NotNull QueryClassifier classifier, @NotNull GraphQueryGateway gateway) {
        this.classifier = classifier;
        this.gateway = gateway;
    }

    @NotNull
    public RouteDecision route(@NotNull String query, @NotNull RouteProfile profile) {
        QueryClassifier.Classification classification = classifier.classify(query);
        QueryRoute classified = classification.route();
        QueryRoute selected = classified;
        String reason = null;

        if (!profile.permits(selected)) {
            selected = profile.substituteRoute();
            reason = "profile " + profile.name() + " does not permit " + classified;
        }
        if (!isAvailable(selected)) {
            QueryRoute unavailable = selected;
            selected = QueryRoute.LOCAL_GRAPH_SEARCH;
            reason = unavailable + " requires the vector index, which the store does not offer";
            logger.info("Route {} unavailable, falling back to {}", unavailable, selected);
        }

        logger.debug("Routed query as {} ({}), selected {}", classified, classification.reason(), selected);
        return new RouteDecision(classified, selected, reason);
    }

    /**
     * Routes tried in order at runtime: the selected route, then each more general route the
     * profile permits and the store can serve.
     */
    @NotNull
    public List<QueryRoute> fallbackChain(@NotNull QueryRoute selected, @NotNull RouteProfile profile) {
        List<QueryRoute> chain = new ArrayList<>();
        chain.add(selected);
        for (QueryRoute next = selected.moreGeneral(); next != null; next = next.moreGeneral()) {
            if (profile.permits(next) && isAvailable(next)) {
                chain.add(next);
            }
        }
        return chain;
    }

    public boolean isAvailable(@NotNull QueryRoute route) {
        return route != QueryRoute.DIRECT_VECTOR_LOOKUP || gateway.supports(GraphCapability.VECTOR_INDEX);
    }
}
