package br.edu.ifba.graphrag.llm;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Text completion model. {@code evidence} is the citation-tagged context the answer must be
 * grounded in; it is empty for auxiliary prompts such as query decomposition.
 */
@FunctionalInterface
public interface CompletionFunction {

    CompletableFuture<String> complete(@NotNull String prompt, @NotNull String evidence);
}
