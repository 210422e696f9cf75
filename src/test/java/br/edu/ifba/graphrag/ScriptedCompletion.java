package br.edu.ifba.graphrag;

import br.edu.ifba.graphrag.llm.CompletionFunction;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Completion model returning queued responses, then a default derived from the evidence.
 */
public class ScriptedCompletion implements CompletionFunction {

    private final Deque<CompletableFuture<String>> queued = new ArrayDeque<>();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<String> evidence = new CopyOnWriteArrayList<>();
    private Function<String, String> fallback = ev -> ev.isEmpty() ? "[]" : "Answer based on the evidence [1].";

    public ScriptedCompletion respond(String answer) {
        queued.add(CompletableFuture.completedFuture(answer));
        return this;
    }

    public ScriptedCompletion fail(RuntimeException error) {
        queued.add(CompletableFuture.failedFuture(error));
        return this;
    }

    public ScriptedCompletion otherwise(Function<String, String> fromEvidence) {
        this.fallback = fromEvidence;
        return this;
    }

    @Override
    public synchronized CompletableFuture<String> complete(@NotNull String prompt, @NotNull String evidenceBlock) {
        prompts.add(prompt);
        evidence.add(evidenceBlock);
        CompletableFuture<String> next = queued.poll();
        return next != null ? next : CompletableFuture.completedFuture(fallback.apply(evidenceBlock));
    }

    public List<String> prompts() {
        return prompts;
    }

    public List<String> evidence() {
        return evidence;
    }
}
