package br.edu.ifba.graphrag.trace;

import br.edu.ifba.graphrag.core.RankedEntity;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Ranked entities produced by the tracer, with the mode that actually ran and its quality.
 */
public record TraceResult(
        @NotNull List<RankedEntity> entities,
        @NotNull TraceMode mode,
        @NotNull TraceQuality quality
) {
    public TraceResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
    }

    public boolean isDegraded() {
        return quality.isDegraded();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public static TraceResult empty(@NotNull TraceMode mode) {
        return new TraceResult(List.of(), mode, mode == TraceMode.BEAM_SEARCH ? TraceQuality.BEAM : TraceQuality.NATIVE);
    }
}
