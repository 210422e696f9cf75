package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pulls candidate entity mentions out of a query.
 */
public interface MentionExtractor {

    CompletableFuture<List<String>> extract(@NotNull String query, @NotNull QueryParam param);
}
