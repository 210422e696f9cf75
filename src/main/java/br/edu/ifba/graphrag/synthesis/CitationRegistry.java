package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.Citation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns sequential citation ids to chunks. A chunk keeps its id for the lifetime of the
 * registry, which spans one query including its gap-fill iterations. Not thread safe.
 */
public class CitationRegistry {

    static final int PREVIEW_LENGTH = 100;

    private final Map<String, Citation> byChunk = new HashMap<>();
    private final List<Citation> ordered = new ArrayList<>();

    /**
     * @return the citation of the chunk, registering it on first sight
     */
    @NotNull
    public Citation register(@NotNull Chunk chunk) {
        Citation existing = byChunk.get(chunk.id());
        if (existing != null) {
            return existing;
        }
        Citation citation = new Citation(ordered.size() + 1, chunk.source(), chunk.sectionLabel(),
            chunk.id(), preview(chunk.text()));
        byChunk.put(chunk.id(), citation);
        ordered.add(citation);
        return citation;
    }

    @Nullable
    public Citation get(int id) {
        return contains(id) ? ordered.get(id - 1) : null;
    }

    public boolean contains(int id) {
        return id >= 1 && id <= ordered.size();
    }

    @NotNull
    public List<Citation> citations() {
        return List.copyOf(ordered);
    }

    public int size() {
        return ordered.size();
    }

    @NotNull
    static String preview(@NotNull String text) {
        String trimmed = text.strip();
        if (trimmed.length() <= PREVIEW_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, PREVIEW_LENGTH) + "...";
    }
}
