package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Read access to the primary store that owns topics and posts.
 * <p>
 * The search core never writes through this interface. Bulk getters return one entry per
 * requested identifier in request order; an entry is {@code null} when the document does
 * not exist (any more).
 */
public interface DocumentStore {

    @Nullable
    Topic getTopic(long tid) throws IOException;

    List<@Nullable Topic> getTopics(List<Long> tids) throws IOException;

    List<@Nullable Post> getPosts(List<Long> pids) throws IOException;

    /**
     * Reads up to {@code limit} members of an ordered set that sort strictly after
     * {@code after}, in set order. {@code after == null} starts at the beginning.
     *
     * @param orderedSetName set name, e.g. {@code topics:tid}, {@code posts:pid} or {@code tid:<tid>:posts}
     * @param after          last member of the previous page, or {@code null}
     * @param limit          maximum number of members to return
     * @return the page, empty when the set is exhausted
     */
    List<ScoredId> getOrderedSetPage(String orderedSetName, @Nullable ScoredId after, int limit) throws IOException;

    /**
     * Global topic and post counts used as the denominator of progress figures.
     */
    IndexTotals getTotals() throws IOException;
}
