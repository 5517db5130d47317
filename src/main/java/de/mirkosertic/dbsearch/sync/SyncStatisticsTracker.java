package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks the progress of a full reindex or clear and logs it periodically.
 * Thread-safe for use from the concurrent topic and post drives.
 */
public class SyncStatisticsTracker {

    private static final Logger logger = LoggerFactory.getLogger(SyncStatisticsTracker.class);

    private final long progressLogIntervalMs;
    private final Map<DocumentKind, KindCounters> counters = new EnumMap<>(DocumentKind.class);

    private final ScheduledExecutorService progressTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "sync-progress-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> progressTimerFuture;

    private volatile long startTime = 0;
    private volatile String mode = "reindex";

    public SyncStatisticsTracker(final ApplicationConfig config) {
        this(config.getProgressLogIntervalMs());
    }

    public SyncStatisticsTracker(final long progressLogIntervalMs) {
        this.progressLogIntervalMs = progressLogIntervalMs;
        for (final DocumentKind kind : DocumentKind.values()) {
            counters.put(kind, new KindCounters());
        }
    }

    /**
     * Resets all counters and starts periodic progress logging for a new run.
     */
    public void start(final String runMode) {
        for (final KindCounters kindCounters : counters.values()) {
            kindCounters.pages.set(0);
            kindCounters.ids.set(0);
            kindCounters.affected.set(0);
        }
        this.mode = runMode;
        this.startTime = System.currentTimeMillis();

        if (progressLogIntervalMs > 0) {
            progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                    this::logProgress,
                    progressLogIntervalMs,
                    progressLogIntervalMs,
                    TimeUnit.MILLISECONDS
            );
        }
        logger.info("Full {} started", runMode);
    }

    public void recordPage(final DocumentKind kind, final int ids, final long affected) {
        final KindCounters kindCounters = counters.get(kind);
        kindCounters.pages.incrementAndGet();
        kindCounters.ids.addAndGet(ids);
        kindCounters.affected.addAndGet(affected);
    }

    /**
     * Stops periodic logging and logs the outcome of the run.
     */
    public void finish(final boolean success) {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
        }

        final SyncStatistics stats = getStatistics();
        final SyncStatistics.KindStatistics topics = stats.perKind().get(DocumentKind.TOPIC);
        final SyncStatistics.KindStatistics posts = stats.perKind().get(DocumentKind.POST);
        if (success) {
            logger.info("Full {} complete in {} seconds: {} topics and {} posts affected ({} ids/sec)",
                    stats.mode(), String.format("%.1f", stats.elapsedTimeMs() / 1000.0),
                    topics.documentsAffected(), posts.documentsAffected(),
                    String.format("%.1f", stats.idsPerSecond()));
        } else {
            logger.warn("Full {} aborted after {} seconds: {} topic ids and {} post ids processed",
                    stats.mode(), String.format("%.1f", stats.elapsedTimeMs() / 1000.0),
                    topics.idsProcessed(), posts.idsProcessed());
        }
    }

    /**
     * Shut down the progress timer executor. Called on application shutdown.
     */
    public void shutdown() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
        }
        progressTimerExecutor.shutdown();
        try {
            if (!progressTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                progressTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            progressTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public SyncStatistics getStatistics() {
        final Map<DocumentKind, SyncStatistics.KindStatistics> perKind = new EnumMap<>(DocumentKind.class);
        for (final Map.Entry<DocumentKind, KindCounters> entry : counters.entrySet()) {
            final KindCounters kindCounters = entry.getValue();
            perKind.put(entry.getKey(), new SyncStatistics.KindStatistics(
                    kindCounters.pages.get(),
                    kindCounters.ids.get(),
                    kindCounters.affected.get()
            ));
        }
        return new SyncStatistics(mode, startTime, System.currentTimeMillis(), perKind);
    }

    private void logProgress() {
        try {
            final SyncStatistics stats = getStatistics();
            final SyncStatistics.KindStatistics topics = stats.perKind().get(DocumentKind.TOPIC);
            final SyncStatistics.KindStatistics posts = stats.perKind().get(DocumentKind.POST);
            logger.info("Full {} progress: {} topic ids in {} pages, {} post ids in {} pages ({} ids/sec)",
                    stats.mode(), topics.idsProcessed(), topics.pagesProcessed(),
                    posts.idsProcessed(), posts.pagesProcessed(), String.format("%.1f", stats.idsPerSecond()));
        } catch (final RuntimeException e) {
            // The scheduler silently cancels a periodic task that throws
            logger.error("Failed to log sync progress", e);
        }
    }

    private static class KindCounters {
        final AtomicLong pages = new AtomicLong(0);
        final AtomicLong ids = new AtomicLong(0);
        final AtomicLong affected = new AtomicLong(0);
    }
}
