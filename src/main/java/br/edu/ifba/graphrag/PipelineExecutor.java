package br.edu.ifba.graphrag;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for pipeline steps that wait on other calls, such as the synthesis loop.
 * Threads carry the application class loader.
 */
@ApplicationScoped
@Typed(PipelineExecutor.class)
public class PipelineExecutor implements Executor {

    private final ExecutorService delegate;

    @Inject
    public PipelineExecutor(@ConfigProperty(name = "graphrag.pipeline.threads", defaultValue = "16") int threads) {
        final ClassLoader classLoader = PipelineExecutor.class.getClassLoader();
        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory factory = task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(classLoader);
                task.run();
            }, "graphrag-pipeline-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.delegate = Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    @Override
    public void execute(@NotNull Runnable command) {
        delegate.execute(command);
    }

    @PreDestroy
    public void shutdown() {
        delegate.shutdownNow();
    }
}
