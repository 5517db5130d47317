package de.mirkosertic.dbsearch.sync;

/**
 * Read-side view of indexing progress as shown on an admin dashboard.
 */
public record ProgressView(
        /** Share of topics indexed, 0 to 100 with two decimals. */
        double topicsPercent,
        /** Share of posts indexed, 0 to 100 with two decimals. */
        double postsPercent,
        long topicsIndexed,
        long postsIndexed,
        boolean working
) {
}
