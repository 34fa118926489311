package de.mirkosertic.docanalyst.batch;

import de.mirkosertic.docanalyst.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool on which documents of a batch are analysed in parallel.
 * Documents share no mutable state, so the pool needs no coordination beyond the queue.
 */
public class AnalysisExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutorService.class);

    private final ThreadPoolExecutor executor;

    public AnalysisExecutorService(final ApplicationConfig config) {
        this(config.getThreadPoolSize());
    }

    public AnalysisExecutorService(final int threadPoolSize) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "analyst-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        // Unbounded queue: a batch is a finite list of documents that is submitted at once
        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.info("AnalysisExecutorService initialized with {} threads", threadPoolSize);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down AnalysisExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("AnalysisExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for AnalysisExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
