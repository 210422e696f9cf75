package br.edu.ifba.query;

import br.edu.ifba.exception.MissingTenantException;
import br.edu.ifba.graphrag.GraphRagService;
import br.edu.ifba.graphrag.core.TenantId;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@Path("/query")
public class QueryResources {

    private static final Logger LOG = Logger.getLogger(QueryResources.class);

    public static final String TENANT_HEADER = "X-Group-ID";

    @Inject
    GraphRagService graphRagService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public CompletionStage<QueryResponse> query(
            @HeaderParam(TENANT_HEADER) final String groupId,
            @Valid @NotNull final QueryRequest request) {
        final TenantId tenant = requireTenant(groupId);
        LOG.debugf("Query received for tenant %s, profile %s", tenant, request.profile());

        final CompletableFuture<QueryResponse> response = new CompletableFuture<>();
        graphRagService.query(request.query(), request.profile(), tenant)
            .whenComplete((answer, error) -> {
                if (error != null) {
                    response.completeExceptionally(AsyncCalls.unwrap(error));
                } else {
                    LOG.infof("Answered query for tenant %s via %s (confidence %.2f)",
                        tenant, answer.routeUsed(), answer.confidence());
                    response.complete(QueryResponse.from(answer));
                }
            });
        return response;
    }

    @GET
    @Path("/profiles")
    @Produces(MediaType.APPLICATION_JSON)
    public ProfilesResponse profiles() {
        return ProfilesResponse.from(graphRagService.profileVersion(), graphRagService.profiles());
    }

    private static TenantId requireTenant(final String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new MissingTenantException(TENANT_HEADER);
        }
        return TenantId.of(groupId);
    }
}
