package br.edu.ifba.graphrag.disambiguation;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * Candidate produced by one matcher for one mention.
 *
 * @param matched the entity text that matched (name, alias or field key)
 */
public record MatchCandidate(
        @NotNull String entityId,
        @NotNull String name,
        @NotNull String matched,
        double confidence
) {
    /**
     * Orders candidates of one mention: higher confidence first, then the smallest length
     * difference between mention and matched text, then name and id.
     */
    public static Comparator<MatchCandidate> ranking(@NotNull String mention) {
        return Comparator.comparingDouble((MatchCandidate c) -> -c.confidence())
            .thenComparingInt(c -> Math.abs(c.matched().length() - mention.length()))
            .thenComparing(MatchCandidate::name)
            .thenComparing(MatchCandidate::entityId);
    }
}
