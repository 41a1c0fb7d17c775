package im.arun.provisiongraph.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for parsing the language versions of one regulation side by side.
 * Each task owns its own stack machine; nothing in the pool is shared between tasks.
 */
public final class ExecutorProvider {
    // One worker per supported language is enough
    private static final int MAX_WORKERS = 4;

    private static ExecutorService executor;

    private ExecutorProvider() {}

    public static synchronized ExecutorService getExecutor() {
        if (executor == null) {
            AtomicInteger counter = new AtomicInteger();
            int workers = Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS);
            executor = Executors.newFixedThreadPool(workers, task -> {
                Thread thread = new Thread(task, "provision-graph-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
        return executor;
    }

    /**
     * Shuts down the pool. A later {@link #getExecutor()} call starts a fresh one.
     */
    public static synchronized void shutdown() {
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }
}
