package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool that runs the independent batch drives of a full reindex or clear side by side.
 */
public class SyncExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SyncExecutorService.class);

    /**
     * Unit of work that may fail with an {@link IOException}.
     */
    @FunctionalInterface
    public interface SyncTask {
        void run() throws IOException;
    }

    private final ThreadPoolExecutor executor;

    public SyncExecutorService(final ApplicationConfig config) {
        this(config.getThreadPoolSize());
    }

    public SyncExecutorService(final int threadPoolSize) {
        final int poolSize = Math.max(1, threadPoolSize);
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "dbsearch-sync-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.info("SyncExecutorService initialized with {} threads", poolSize);
    }

    /**
     * Runs all tasks concurrently and waits until every one of them has finished.
     * <p>
     * A failing task does not cancel the others. The first failure is rethrown once all
     * tasks are done; later failures are attached to it as suppressed exceptions.
     */
    public void runAll(final List<SyncTask> tasks) throws IOException {
        final List<Future<?>> futures = new ArrayList<>(tasks.size());
        for (final SyncTask task : tasks) {
            futures.add(executor.submit(() -> {
                task.run();
                return null;
            }));
        }

        Throwable failure = null;
        for (final Future<?> future : futures) {
            try {
                future.get();
            } catch (final InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                final InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting for sync tasks");
                interrupted.initCause(e);
                throw interrupted;
            } catch (final ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause();
                } else {
                    failure.addSuppressed(e.getCause());
                }
            }
        }

        if (failure instanceof IOException) {
            throw (IOException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw new IOException("Sync task failed", failure);
        }
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down SyncExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("SyncExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SyncExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
