package de.mirkosertic.mcp.vehiclesearch.index;

import de.mirkosertic.mcp.vehiclesearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vehiclesearch.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs storage calls on a bounded worker pool with a per-call deadline.
 * Every failure leaves as a {@link StorageException}; nothing is retried here.
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private static final int QUEUE_CAPACITY = 1000;

    /**
     * A unit of work against the index.
     */
    @FunctionalInterface
    public interface StorageCall<T> {
        T call() throws IOException;
    }

    private final ThreadPoolExecutor executor;
    private final long timeoutMs;

    public QueryExecutor(final ApplicationConfig config) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "inventory-query-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.timeoutMs = config.getQueryTimeoutMs();
        this.executor = new ThreadPoolExecutor(
                config.getWorkerThreads(),
                config.getWorkerThreads(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );

        logger.info("QueryExecutor initialized with {} threads and {}ms deadline", config.getWorkerThreads(), timeoutMs);
    }

    public <T> T execute(final String operation, final StorageCall<T> call) throws StorageException {
        final Callable<T> task = call::call;
        final Future<T> future;
        try {
            future = executor.submit(task);
        } catch (final RejectedExecutionException e) {
            logger.warn("Storage call {} rejected, worker pool saturated or shut down", operation);
            throw StorageException.unavailable(operation, e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            logger.warn("Storage call {} exceeded deadline of {}ms", operation, timeoutMs);
            throw StorageException.timeout(operation, timeoutMs, e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw StorageException.unavailable(operation, e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Storage call {} failed", operation, cause);
            throw StorageException.unavailable(operation, cause);
        }
    }

    /**
     * Shutdown the worker pool. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down QueryExecutor");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("QueryExecutor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for QueryExecutor to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
