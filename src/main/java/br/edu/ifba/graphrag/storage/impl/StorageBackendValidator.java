package br.edu.ifba.graphrag.storage.impl;

import br.edu.ifba.graphrag.storage.KnowledgeGraphStore;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fails start-up unless exactly one knowledge graph store matching
 * {@code graphrag.storage.backend} ({@code memory} or {@code age}) is active.
 */
@ApplicationScoped
public class StorageBackendValidator {

    private static final Logger logger = LoggerFactory.getLogger(StorageBackendValidator.class);

    static final Set<String> SUPPORTED_BACKENDS = Set.of("memory", "age");

    @ConfigProperty(name = "graphrag.storage.backend", defaultValue = "memory")
    String configuredBackend;

    @Inject
    Instance<KnowledgeGraphStore> stores;

    void onStart(@Observes StartupEvent event) {
        String backend = validateBackendName(configuredBackend);
        List<String> active = new ArrayList<>();
        for (KnowledgeGraphStore store : stores) {
            active.add(store.getClass().getSimpleName());
        }
        validateActiveImplementations(backend, active);
        logger.info("Storage backend validation complete: {} backend active ({})", backend, active);
    }

    static String validateBackendName(String backend) {
        if (backend == null || backend.isBlank()) {
            throw new IllegalStateException(
                "Storage backend not configured. Set 'graphrag.storage.backend' to 'memory' or 'age'");
        }
        String normalized = backend.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_BACKENDS.contains(normalized)) {
            throw new IllegalStateException(
                "Invalid storage backend: '" + backend + "'. Supported backends: 'memory', 'age'");
        }
        return normalized;
    }

    static void validateActiveImplementations(String backend, List<String> active) {
        if (active.isEmpty()) {
            throw new IllegalStateException("No KnowledgeGraphStore implementation active for backend '" + backend + "'");
        }
        if (active.size() > 1) {
            throw new IllegalStateException("Multiple KnowledgeGraphStore implementations active: " + active);
        }
        String expectedPrefix = "age".equals(backend) ? "Age" : "InMemory";
        if (!active.get(0).startsWith(expectedPrefix)) {
            logger.warn("Backend configured as '{}' but KnowledgeGraphStore is {}", backend, active.get(0));
        }
    }
}
