package br.edu.ifba.graphrag.routing;

import br.edu.ifba.graphrag.core.QueryRoute;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of routing one query.
 *
 * @param classified route the classifier chose
 * @param selected   route to execute after profile and index constraints
 * @param reason     why {@code selected} differs from {@code classified}, or null
 */
public record RouteDecision(
        @NotNull QueryRoute classified,
        @NotNull QueryRoute selected,
        @Nullable String reason
) {
    public boolean isSubstituted() {
        return classified != selected;
    }
}
