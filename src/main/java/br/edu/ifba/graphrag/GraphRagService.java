package br.edu.ifba.graphrag;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.GraphRagConfig;
import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.TenantId;
import br.edu.ifba.graphrag.query.QueryCacheService;
import br.edu.ifba.graphrag.query.QueryOrchestrator;
import br.edu.ifba.graphrag.routing.ProfileRegistry;
import br.edu.ifba.graphrag.routing.RouteProfile;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the question answering pipeline.
 *
 * <p>Resolves the profile, builds the per-query {@link QueryParam} from configuration,
 * consults the answer cache and hands the query to the {@link QueryOrchestrator}.
 * Tenant violations and an unreachable store fail the returned future; every other
 * failure becomes an insufficient-evidence answer.</p>
 */
@ApplicationScoped
public class GraphRagService {

    private static final Logger logger = LoggerFactory.getLogger(GraphRagService.class);

    private final GraphRagConfig config;
    private final ProfileRegistry profiles;
    private final QueryOrchestrator orchestrator;
    private final QueryCacheService cache;

    @Inject
    public GraphRagService(GraphRagConfig config, ProfileRegistry profiles, QueryOrchestrator orchestrator) {
        this.config = config;
        this.profiles = profiles;
        this.orchestrator = orchestrator;
        this.cache = new QueryCacheService(config.cache().enabled(), config.cache().ttl(), config.cache().maximumSize());
    }

    @PostConstruct
    void validateConfig() {
        config.validate();
        logger.info("GraphRagService ready: profiles={}, cache={}", profiles.profiles().keySet(),
            config.cache().enabled() ? "enabled" : "disabled");
    }

    /**
     * Answers a question for a tenant.
     *
     * @param query       question text
     * @param profileName profile name, or null for the default profile
     * @param tenant      requesting tenant
     * @return the answer; fails only with fatal errors or an unknown profile
     */
    public CompletableFuture<GraphRagAnswer> query(
            @NotNull String query, @Nullable String profileName, @NotNull TenantId tenant) {
        MDC.put("tenant", tenant.value());
        try {
            RouteProfile profile = profiles.get(profileName);
            Optional<GraphRagAnswer> cached = cache.get(tenant, query, profile.name());
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }

            QueryContext context = new QueryContext(query, toParam(tenant, profile.name()));
            logger.info("Executing query for tenant {} with profile {}", tenant, profile.name());
            return orchestrator.execute(context, profile)
                .thenApply(answer -> {
                    cache.store(tenant, query, profile.name(), answer);
                    return answer;
                })
                .exceptionally(error -> {
                    AsyncCalls.rethrowIfFatal(error);
                    logger.warn("Query failed for tenant {}, answering with insufficient evidence: {}",
                        tenant, AsyncCalls.unwrap(error).getMessage());
                    return GraphRagAnswer.insufficientEvidence(profile.substituteRoute(), false);
                });
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            MDC.remove("tenant");
        }
    }

    @NotNull
    public Map<String, RouteProfile> profiles() {
        return profiles.profiles();
    }

    public String profileVersion() {
        return profiles.version();
    }

    QueryParam toParam(TenantId tenant, String profile) {
        return QueryParam.builder()
            .tenant(tenant)
            .profile(profile)
            .beamWidth(config.trace().beamWidth())
            .maxHops(config.trace().maxHops())
            .damping(config.trace().damping())
            .maxIterations(config.trace().maxIterations())
            .topK(config.trace().topK())
            .oneHopLimit(config.trace().oneHopLimit())
            .twoHopLimit(config.trace().twoHopLimit())
            .limitPerEntity(config.synthesis().limitPerEntity())
            .gapFillIterations(config.synthesis().gapFillIterations())
            .confidenceThreshold(config.synthesis().confidenceThreshold())
            .maxSubQuestions(config.multiHop().maxSubQuestions())
            .maxCandidatesPerMention(config.disambiguation().maxCandidatesPerMention())
            .storeCallTimeout(config.timeouts().storeCall())
            .embeddingCallTimeout(config.timeouts().embeddingCall())
            .completionCallTimeout(config.timeouts().completionCall())
            .queryTimeout(config.timeouts().queryDeadline())
            .build();
    }
}
