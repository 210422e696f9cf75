package br.edu.ifba.graphrag.storage.impl;

import br.edu.ifba.exception.BackendDegradedException;
import br.edu.ifba.exception.KnowledgeGraphUnavailableException;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.KnowledgeGraphStore;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import br.edu.ifba.graphrag.utils.RetryEventLogger;
import br.edu.ifba.graphrag.utils.TransientSQLExceptionPredicate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jetbrains.annotations.NotNull;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Apache AGE (PostgreSQL graph extension) implementation of {@link KnowledgeGraphStore}.
 *
 * <p>Statements are sent as parameterized Cypher through {@code ag_catalog.cypher}; the
 * parameter map, including {@code group_id}, travels as a single agtype argument, so tenant
 * ids are never spliced into query text. Every template returns one map column.</p>
 */
@ApplicationScoped
@IfBuildProperty(name = "graphrag.storage.backend", stringValue = "age")
public class AgeKnowledgeGraphStore implements KnowledgeGraphStore {

    private static final Logger logger = LoggerFactory.getLogger(AgeKnowledgeGraphStore.class);

    private static final int MAX_ATTEMPTS = 4;
    private static final Pattern AGTYPE_SUFFIX = Pattern.compile("::(vertex|edge|path|numeric|float|integer)");
    private static final Pattern GRAPH_NAME = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    @Inject
    AgeConfig config;

    @Inject
    RetryEventLogger retryEventLogger;

    @ConfigProperty(name = "graphrag.storage.age.capabilities", defaultValue = "none")
    List<String> configuredCapabilities;

    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    /**
     * Default constructor for CDI.
     */
    public AgeKnowledgeGraphStore() {
        this.objectMapper = new ObjectMapper();
        this.executor = Executors.newFixedThreadPool(Math.max(4, Runtime.getRuntime().availableProcessors()));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    @Override
    @NotNull
    public Set<GraphCapability> capabilities() {
        Set<GraphCapability> result = EnumSet.noneOf(GraphCapability.class);
        for (String name : configuredCapabilities) {
            String trimmed = name.trim().toUpperCase(Locale.ROOT);
            if (!trimmed.isEmpty() && !"NONE".equals(trimmed)) {
                result.add(GraphCapability.valueOf(trimmed));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    @Retry(maxRetries = 3, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSQLExceptionPredicate.class)
    public CompletableFuture<List<GraphRow>> query(@NotNull TenantScopedStatement statement) {
        final String operation = statement.query().name();
        final int attempt = attempts.computeIfAbsent(statement.id(), k -> new AtomicInteger()).incrementAndGet();

        return CompletableFuture.supplyAsync(() -> {
            GraphCapability required = statement.query().requiredCapability();
            if (required != null && !capabilities().contains(required)) {
                throw new BackendDegradedException("AGE store configured without " + required);
            }
            try {
                List<GraphRow> rows = execute(statement);
                attempts.remove(statement.id());
                retryEventLogger.logRetrySuccess(operation, attempt);
                return rows;
            } catch (SQLException e) {
                boolean transientFailure = new TransientSQLExceptionPredicate().test(e);
                if (transientFailure && attempt < MAX_ATTEMPTS) {
                    retryEventLogger.logRetryAttempt(operation, attempt, MAX_ATTEMPTS, e);
                } else {
                    attempts.remove(statement.id());
                    retryEventLogger.logRetryExhausted(operation, attempt, e);
                }
                if (TransientSQLExceptionPredicate.isConnectionFailure(e)) {
                    throw new KnowledgeGraphUnavailableException("Apache AGE backend unreachable", e);
                }
                logger.error("Failed to execute {} for tenant {}", operation, statement.tenant(), e);
                throw new IllegalStateException("Graph query " + operation + " failed: " + e.getMessage(), e);
            }
        }, executor);
    }

    private List<GraphRow> execute(TenantScopedStatement statement) throws SQLException {
        String graphName = config.getGraphName();
        if (!GRAPH_NAME.matcher(graphName).matches()) {
            throw new IllegalStateException("Invalid AGE graph name: " + graphName);
        }
        String sql = "SELECT * FROM ag_catalog.cypher('" + graphName + "', $$ "
            + statement.query().cypher() + " $$, ?) AS (row agtype)";

        try (Connection conn = config.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            PGobject params = new PGobject();
            params.setType("agtype");
            params.setValue(objectMapper.writeValueAsString(statement.params()));
            ps.setObject(1, params);

            List<GraphRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new GraphRow(parseAgtypeMap(rs.getString(1))));
                }
            }
            logger.debug("{} returned {} row(s) for tenant {}", statement.query(), rows.size(), statement.tenant());
            return rows;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode parameters for " + statement.query(), e);
        }
    }

    private Map<String, Object> parseAgtypeMap(String agtype) throws JsonProcessingException {
        if (agtype == null) {
            return Map.of();
        }
        String json = AGTYPE_SUFFIX.matcher(agtype).replaceAll("");
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
    }
}
