package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Entity with the relevance score assigned by the tracer.
 */
public record RankedEntity(@NotNull String entityId, @NotNull String name, double score) {

    public RankedEntity {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public RankedEntity withScore(double newScore) {
        return new RankedEntity(entityId, name, newScore);
    }
}
