package de.mirkosertic.dbsearch.sync;

import java.util.Map;

public record SyncStatistics(
        /** The run that produced these statistics: {@code "reindex"} or {@code "clear"}. */
        String mode,
        long startTimeMs,
        long endTimeMs,
        Map<DocumentKind, KindStatistics> perKind
) {

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    public long idsProcessed() {
        return perKind.values().stream().mapToLong(KindStatistics::idsProcessed).sum();
    }

    public double idsPerSecond() {
        final long elapsedMs = elapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (double) idsProcessed() / (elapsedMs / 1000.0);
    }

    public record KindStatistics(
            long pagesProcessed,
            /** Identifiers read from the ordered set. */
            long idsProcessed,
            /** Records written to (reindex) or removed from (clear) the index. */
            long documentsAffected
    ) {
    }
}
