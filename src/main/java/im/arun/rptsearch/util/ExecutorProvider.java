package im.arun.rptsearch.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides a shared bounded thread pool for page decompression and classification.
 * Keeps CompletableFuture.supplyAsync() off the common ForkJoinPool.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static volatile int poolSize = 0;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Sets the pool size used when the pool is next created. 0 or less means one
     * thread per available processor. Has no effect on a pool already running.
     */
    public static void configure(int threads) {
        synchronized (LOCK) {
            poolSize = threads;
        }
    }

    /**
     * Returns the shared ExecutorService. Page work is CPU-bound (inflate, scoring),
     * so the default size is the processor count.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int size = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
                    instance = Executors.newFixedThreadPool(size, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "rptsearch-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
