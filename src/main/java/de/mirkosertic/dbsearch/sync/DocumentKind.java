package de.mirkosertic.dbsearch.sync;

/**
 * The two kinds of forum documents that are kept in the search index.
 * <p>
 * Each kind has its own identifier space, its own ordered set of all identifiers
 * in the primary store and its own persisted indexed-counter.
 */
public enum DocumentKind {

    TOPIC("topic", "topics:tid", "topicsIndexed"),
    POST("post", "posts:pid", "postsIndexed");

    private final String indexName;
    private final String orderedSetName;
    private final String counterField;

    DocumentKind(final String indexName, final String orderedSetName, final String counterField) {
        this.indexName = indexName;
        this.orderedSetName = orderedSetName;
        this.counterField = counterField;
    }

    /**
     * Name used by the index engine and by search requests ({@code "topic"} / {@code "post"}).
     */
    public String indexName() {
        return indexName;
    }

    /**
     * Name of the ordered set in the primary store that holds every identifier of this kind.
     */
    public String orderedSetName() {
        return orderedSetName;
    }

    /**
     * Persisted settings field that counts indexed documents of this kind.
     */
    public String counterField() {
        return counterField;
    }

    public static DocumentKind fromIndexName(final String indexName) {
        for (final DocumentKind kind : values()) {
            if (kind.indexName.equals(indexName)) {
                return kind;
            }
        }
        throw new InvalidInputException("Unknown index: " + indexName);
    }
}
