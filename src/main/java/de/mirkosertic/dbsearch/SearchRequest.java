package de.mirkosertic.dbsearch;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Search request as issued by the host's search page.
 */
public record SearchRequest(
        /** {@code "topic"} or {@code "post"}. */
        @Nullable String index,
        @Nullable List<Long> categoryIds,
        @Nullable Long authorId,
        @Nullable String contentText,
        /** {@code "all"} (default) or {@code "any"}. */
        @Nullable String matchWords
) {

    public static SearchRequest content(final String index, final String contentText) {
        return new SearchRequest(index, null, null, contentText, null);
    }
}
