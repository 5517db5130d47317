package de.mirkosertic.dbsearch;

import de.mirkosertic.dbsearch.sync.DocumentKind;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;

/**
 * Full-text index engine that stores {@link IndexRecord}s and answers searches with identifiers.
 */
public interface SearchIndex extends Closeable {

    /**
     * Prepares the index for the given engine language identifier.
     */
    void createIndices(String language) throws IndexEngineException;

    /**
     * Switches the language used for analysis of subsequent writes and searches.
     */
    void changeIndexLanguage(String language) throws IndexEngineException;

    /**
     * {@code true} if the engine takes short language codes, {@code false} if it needs full names.
     */
    boolean acceptsLanguageCodes();

    /**
     * Inserts or replaces records. A record replaces any record of the same kind and identifier.
     */
    void indexDocuments(DocumentKind kind, List<IndexRecord> records) throws IndexEngineException;

    /**
     * Removes records by identifier. Unknown identifiers are ignored.
     */
    void removeDocuments(DocumentKind kind, Collection<Long> ids) throws IndexEngineException;

    List<Long> search(DocumentKind kind, SearchQuery query, int limit) throws IndexEngineException;
}
