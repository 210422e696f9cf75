package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Entity node of the knowledge graph as seen by the query pipeline.
 *
 * @param id        stable node identifier
 * @param name      canonical display name
 * @param aliases   alternative surface forms
 * @param embedding stored name embedding, or null when the store has none
 * @param degree    number of RELATED_TO edges, used to pick hub entities
 */
public record Entity(
        @NotNull String id,
        @NotNull String name,
        @NotNull List<String> aliases,
        @Nullable float[] embedding,
        int degree
) {
    public Entity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
