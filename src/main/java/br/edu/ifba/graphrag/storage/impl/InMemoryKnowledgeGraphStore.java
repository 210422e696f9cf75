package br.edu.ifba.graphrag.storage.impl;

import br.edu.ifba.exception.BackendDegradedException;
import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.KnowledgeGraphStore;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory knowledge graph loaded from a JSON {@link GraphSnapshot}.
 * Data is partitioned by tenant; a statement only ever sees its own tenant's partition.
 */
@ApplicationScoped
@IfBuildProperty(name = "graphrag.storage.backend", stringValue = "memory", enableIfMissing = true)
public class InMemoryKnowledgeGraphStore implements KnowledgeGraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryKnowledgeGraphStore.class);

    @ConfigProperty(name = "graphrag.storage.memory.snapshot", defaultValue = "graph/sample-graph.json")
    String snapshotLocation;

    @ConfigProperty(name = "graphrag.storage.memory.capabilities", defaultValue = "NATIVE_RANKING,VECTOR_INDEX")
    List<String> configuredCapabilities;

    @Inject
    ObjectMapper objectMapper;

    private final Map<String, TenantGraph> tenants = new ConcurrentHashMap<>();
    private final Set<GraphCapability> capabilities = EnumSet.noneOf(GraphCapability.class);
    private volatile boolean initialized = false;

    /**
     * Default constructor for CDI.
     */
    public InMemoryKnowledgeGraphStore() {
    }

    public InMemoryKnowledgeGraphStore(@NotNull GraphSnapshot snapshot, @NotNull Set<GraphCapability> capabilities) {
        load(snapshot);
        this.capabilities.addAll(capabilities);
        this.initialized = true;
    }

    @PostConstruct
    void initialize() {
        if (initialized) {
            return;
        }
        for (String name : configuredCapabilities) {
            String trimmed = name.trim().toUpperCase(Locale.ROOT);
            if (!trimmed.isEmpty() && !"NONE".equals(trimmed)) {
                capabilities.add(GraphCapability.valueOf(trimmed));
            }
        }
        load(new GraphSnapshotLoader(objectMapper).load(snapshotLocation));
        initialized = true;
        logger.info("InMemoryKnowledgeGraphStore initialized: {} tenant(s), capabilities={}",
            tenants.size(), capabilities);
    }

    private void load(GraphSnapshot snapshot) {
        snapshot.tenants().forEach((groupId, tenantSnapshot) -> {
            TenantGraph graph = new TenantGraph(groupId, tenantSnapshot);
            tenants.put(groupId, graph);
            logger.debug("Loaded tenant {} with {} entities", groupId, graph.entityCount());
        });
    }

    @Override
    public CompletableFuture<List<GraphRow>> query(@NotNull TenantScopedStatement statement) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            GraphCapability required = statement.query().requiredCapability();
            if (required != null && !capabilities.contains(required)) {
                throw new BackendDegradedException("In-memory store configured without " + required);
            }
            TenantGraph graph = tenants.get(statement.tenant().value());
            if (graph == null) {
                return List.of();
            }
            List<GraphRow> rows = new ArrayList<>();
            for (Map<String, Object> values : graph.execute(statement)) {
                rows.add(new GraphRow(Collections.unmodifiableMap(values)));
            }
            return rows;
        });
    }

    @Override
    @NotNull
    public Set<GraphCapability> capabilities() {
        return Collections.unmodifiableSet(capabilities);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("InMemoryKnowledgeGraphStore not initialized");
        }
    }
}
