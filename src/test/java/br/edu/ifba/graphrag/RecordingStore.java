package br.edu.ifba.graphrag;

import br.edu.ifba.graphrag.storage.GraphCapability;
import br.edu.ifba.graphrag.storage.GraphQuery;
import br.edu.ifba.graphrag.storage.GraphRow;
import br.edu.ifba.graphrag.storage.KnowledgeGraphStore;
import br.edu.ifba.graphrag.storage.TenantScopedStatement;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Store decorator that records every statement and can fail chosen statements.
 */
public class RecordingStore implements KnowledgeGraphStore {

    private final KnowledgeGraphStore delegate;
    private final Set<GraphCapability> capabilities;
    private final List<TenantScopedStatement> statements = new CopyOnWriteArrayList<>();
    private final Map<GraphQuery, RuntimeException> failures = new EnumMap<>(GraphQuery.class);

    public RecordingStore(KnowledgeGraphStore delegate, Set<GraphCapability> capabilities) {
        this.delegate = delegate;
        this.capabilities = capabilities.isEmpty()
            ? EnumSet.noneOf(GraphCapability.class)
            : EnumSet.copyOf(capabilities);
    }

    public static RecordingStore over(Set<GraphCapability> capabilities) {
        return new RecordingStore(TestGraphs.store(EnumSet.allOf(GraphCapability.class)), capabilities);
    }

    public RecordingStore failing(GraphQuery query, RuntimeException error) {
        failures.put(query, error);
        return this;
    }

    @Override
    public CompletableFuture<List<GraphRow>> query(@NotNull TenantScopedStatement statement) {
        statements.add(statement);
        RuntimeException failure = failures.get(statement.query());
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return delegate.query(statement);
    }

    @Override
    public @NotNull Set<GraphCapability> capabilities() {
        return capabilities;
    }

    public List<TenantScopedStatement> statements() {
        return statements;
    }

    public long count(GraphQuery query) {
        return statements.stream().filter(s -> s.query() == query).count();
    }
}
