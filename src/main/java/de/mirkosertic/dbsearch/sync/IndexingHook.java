package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.IndexRecord;

import java.util.List;

/**
 * Extension point called with the records of one kind right before they are written to the
 * index. A hook may rewrite records or drop some of them; only the returned records are
 * indexed and counted.
 */
@FunctionalInterface
public interface IndexingHook {

    /**
     * @param kind      kind of all records and documents
     * @param records   records about to be indexed
     * @param documents the eligible source documents the records were built from
     * @return the records to index instead
     */
    List<IndexRecord> beforeIndex(DocumentKind kind, List<IndexRecord> records, List<ForumDocument> documents);
}
