package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;

/**
 * Read-only view of a document owned by the primary store.
 */
public interface ForumDocument {

    DocumentKind kind();

    long id();

    /**
     * Owning category. For posts this is the effective category inherited from the
     * parent topic and may be {@code null} until it has been resolved.
     */
    @Nullable
    Long categoryId();

    long authorId();

    boolean deleted();

    /**
     * The raw text field that gets indexed: the title of a topic, the body of a post.
     */
    @Nullable
    String text();
}
