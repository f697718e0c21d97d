package im.arun.booksplit.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the bounded worker pools that run split jobs.
 * Keeps job work off the common ForkJoinPool, which CompletableFuture would otherwise use.
 */
public final class ExecutorProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);

    private ExecutorProvider() {}

    /**
     * Fixed pool of daemon threads named {@code <prefix>-<n>}.
     *
     * @param threads pool size, at least 1
     */
    public static ExecutorService newWorkerPool(int threads, String prefix) {
        int poolSize = Math.max(1, threads);
        return Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    /**
     * Stop accepting work, wait for running jobs, then interrupt whatever is left.
     */
    public static void shutdown(ExecutorService executor, long timeoutSeconds) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    logger.error("Executor did not terminate");
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
