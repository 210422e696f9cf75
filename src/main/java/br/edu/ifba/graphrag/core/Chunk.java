package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Text chunk with the provenance needed to cite it.
 *
 * @param id           chunk identifier
 * @param text         full chunk text
 * @param source       document title or url
 * @param sectionTitle title of the containing section, if any
 * @param sectionPath  heading path of the containing section, outermost first
 * @param entityIds    entities through which the chunk was reached, in the order they reached it
 */
public record Chunk(
        @NotNull String id,
        @NotNull String text,
        @NotNull String source,
        @Nullable String sectionTitle,
        @NotNull List<String> sectionPath,
        @NotNull Set<String> entityIds
) {
    public Chunk {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(source, "source must not be null");
        sectionPath = sectionPath != null ? List.copyOf(sectionPath) : List.of();
        entityIds = entityIds != null ? Collections.unmodifiableSet(new LinkedHashSet<>(entityIds)) : Set.of();
    }

    /**
     * Same chunk, also credited to the given entities.
     */
    @NotNull
    public Chunk withEntityIds(@NotNull Set<String> more) {
        if (entityIds.containsAll(more)) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(entityIds);
        merged.addAll(more);
        return new Chunk(id, text, source, sectionTitle, sectionPath, merged);
    }

    /**
     * Section label used in citations: the heading path joined with {@code " > "},
     * the section title, or {@code "General"}.
     */
    @NotNull
    public String sectionLabel() {
        if (!sectionPath.isEmpty()) {
            return String.join(" > ", sectionPath);
        }
        if (sectionTitle != null && !sectionTitle.isBlank()) {
            return sectionTitle;
        }
        return "General";
    }
}
