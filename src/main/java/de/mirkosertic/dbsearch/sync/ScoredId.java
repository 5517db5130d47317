package de.mirkosertic.dbsearch.sync;

/**
 * Member of an ordered identifier set. Sets are ordered by score, ties broken by id.
 */
public record ScoredId(long id, double score) implements Comparable<ScoredId> {

    @Override
    public int compareTo(final ScoredId other) {
        final int byScore = Double.compare(score, other.score);
        return byScore != 0 ? byScore : Long.compare(id, other.id);
    }
}
