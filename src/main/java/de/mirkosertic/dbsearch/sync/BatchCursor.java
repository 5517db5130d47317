package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks an ordered identifier set page by page and hands every page to a handler.
 * <p>
 * Paging is keyset based: each page is requested relative to the last member of the
 * previous page, so members removed while the scan runs never shift later members out
 * of view. Only one page is held in memory at a time, and pages are processed strictly
 * one after another. Nothing is persisted; a restarted scan begins at the start of the set
 * unless the caller passes a {@link Position} it kept itself.
 */
public class BatchCursor {

    private static final Logger logger = LoggerFactory.getLogger(BatchCursor.class);

    /**
     * Handler invoked once per page with the identifiers of that page.
     */
    @FunctionalInterface
    public interface PageHandler {
        void handle(List<Long> ids) throws IOException;
    }

    /**
     * Opaque position within an ordered set. {@link #START} denotes the beginning.
     */
    public static final class Position {

        public static final Position START = new Position(null);

        private final @Nullable ScoredId last;

        private Position(final @Nullable ScoredId last) {
            this.last = last;
        }

        /**
         * Position right after the given set member.
         */
        public static Position after(final ScoredId member) {
            return new Position(member);
        }

        @Override
        public String toString() {
            return last == null ? "START" : "after " + last;
        }
    }

    private final DocumentStore documentStore;

    public BatchCursor(final DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    /**
     * Processes the whole set from the beginning.
     *
     * @return number of identifiers handed to the handler
     * @throws IterationException if a page cannot be read from the store
     * @throws IOException        whatever the handler throws; the remaining pages are skipped
     */
    public long forEachBatch(final String orderedSetName, final int pageSize, final PageHandler handler)
            throws IOException {
        return forEachBatch(orderedSetName, pageSize, Position.START, handler);
    }

    /**
     * Processes the set starting after {@code from}.
     */
    public long forEachBatch(final String orderedSetName, final int pageSize, final Position from,
                             final PageHandler handler) throws IOException {
        if (pageSize <= 0) {
            throw new InvalidInputException("Page size must be positive: " + pageSize);
        }

        Position position = from;
        long total = 0;
        int pages = 0;
        while (true) {
            final List<ScoredId> page = readPage(orderedSetName, position, pageSize);
            if (page.isEmpty()) {
                break;
            }

            final List<Long> ids = new ArrayList<>(page.size());
            for (final ScoredId member : page) {
                ids.add(member.id());
            }
            handler.handle(ids);

            total += ids.size();
            pages++;
            position = Position.after(page.get(page.size() - 1));

            if (page.size() < pageSize) {
                break;
            }
        }

        logger.debug("Processed {} ids in {} pages of {}", total, pages, orderedSetName);
        return total;
    }

    private List<ScoredId> readPage(final String orderedSetName, final Position position, final int pageSize)
            throws IterationException {
        final List<ScoredId> page;
        try {
            page = documentStore.getOrderedSetPage(orderedSetName, position.last, pageSize);
        } catch (final IOException | RuntimeException e) {
            throw new IterationException(orderedSetName, e);
        }
        if (page.size() > pageSize) {
            // Never hand out more than asked for, even if the store over-delivers.
            return page.subList(0, pageSize);
        }
        return page;
    }
}
