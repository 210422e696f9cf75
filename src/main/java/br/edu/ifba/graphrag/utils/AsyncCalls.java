package br.edu.ifba.graphrag.utils;

import br.edu.ifba.exception.KnowledgeGraphUnavailableException;
import br.edu.ifba.exception.TenantIsolationViolationException;
import br.edu.ifba.exception.UpstreamTimeoutException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Timeout and failure-classification helpers for the asynchronous pipeline.
 */
public final class AsyncCalls {

    private AsyncCalls() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Bounds a call with a timeout. On expiry the returned future fails with
     * {@link UpstreamTimeoutException} naming the operation.
     */
    @NotNull
    public static <T> CompletableFuture<T> withTimeout(
            @NotNull CompletableFuture<T> call,
            @NotNull Duration timeout,
            @NotNull String operation) {
        return call
            .orTimeout(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)
            .handle((value, error) -> {
                if (error == null) {
                    return value;
                }
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    throw new UpstreamTimeoutException(operation, timeout);
                }
                throw asUnchecked(cause);
            });
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Fatal failures abort the request; everything else may be recovered by fallback.
     */
    public static boolean isFatal(@NotNull Throwable error) {
        Throwable cause = unwrap(error);
        return cause instanceof TenantIsolationViolationException
            || cause instanceof KnowledgeGraphUnavailableException;
    }

    /**
     * Rethrows fatal failures unchanged so recovery stages never absorb them.
     */
    public static void rethrowIfFatal(@NotNull Throwable error) {
        if (isFatal(error)) {
            throw asUnchecked(unwrap(error));
        }
    }

    @NotNull
    public static RuntimeException asUnchecked(@NotNull Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new CompletionException(error);
    }
}
