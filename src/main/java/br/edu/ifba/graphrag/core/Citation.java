package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Citation attached to an answer. {@code section} is kept separate from {@code source}
 * so that answers drawn from several parts of one document stay distinguishable.
 */
public record Citation(
        int id,
        @NotNull String source,
        @NotNull String section,
        @JsonProperty("chunk_id") @NotNull String chunkId,
        @JsonProperty("text_preview") @NotNull String textPreview
) {
    public Citation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        Objects.requireNonNull(textPreview, "textPreview must not be null");
    }
}
