package de.mirkosertic.dbsearch;

import de.mirkosertic.dbsearch.sync.DocumentKind;
import org.jspecify.annotations.Nullable;

/**
 * Searchable projection of a topic or post, keyed by kind and identifier.
 */
public record IndexRecord(
        DocumentKind kind,
        long id,
        /** Normalized token text. */
        String content,
        @Nullable Long categoryId,
        long authorId
) {
}
