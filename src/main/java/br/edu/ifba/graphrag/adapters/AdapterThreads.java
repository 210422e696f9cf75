package br.edu.ifba.graphrag.adapters;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for blocking REST client calls. Threads carry the Quarkus class loader so
 * that REST client providers resolve from worker threads.
 */
final class AdapterThreads {

    private AdapterThreads() {
        throw new UnsupportedOperationException("Utility class");
    }

    static ExecutorService newPool(final String prefix) {
        final ClassLoader classLoader = AdapterThreads.class.getClassLoader();
        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory factory = task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(classLoader);
                task.run();
            }, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
