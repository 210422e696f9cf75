package br.edu.ifba.graphrag.disambiguation;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A mention resolved to a graph entity.
 *
 * @param entityId   resolved entity
 * @param name       entity name
 * @param confidence confidence of the strategy that produced the match
 * @param strategy   strategy that produced the match
 * @param mention    normalized mention text
 */
public record ResolvedEntity(
        @NotNull String entityId,
        @NotNull String name,
        double confidence,
        @NotNull MatchStrategy strategy,
        @NotNull String mention
) {
    public ResolvedEntity {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(mention, "mention must not be null");
    }
}
