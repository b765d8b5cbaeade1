package im.arun.regingest.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the process-wide worker pool handed to every loader.
 *
 * <p>Threads are created on demand and reclaimed when idle. Page, enrichment and sub-resource
 * tasks wait on each other, so a fixed-size pool could starve itself; fan-out is bounded by
 * the callers' semaphores and outbound traffic by the rate limiter instead.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    instance = newWorkerPool("regingest-worker-");
                }
            }
        }
        return instance;
    }

    /**
     * Creates a separate daemon pool. Tests use this to get an executor they can shut down.
     */
    public static ExecutorService newWorkerPool(String threadPrefix) {
        return Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, threadPrefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdownNow();
                instance = null;
            }
        }
    }
}
