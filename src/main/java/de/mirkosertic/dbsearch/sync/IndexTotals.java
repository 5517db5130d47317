package de.mirkosertic.dbsearch.sync;

/**
 * True document totals as reported by the primary store.
 */
public record IndexTotals(long topicCount, long postCount) {
}
