package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.settings.SearchSettings;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a document may appear in the search index at all.
 * <p>
 * A document is eligible when it is not deleted, its category is not excluded by the
 * current settings and its title or body has text after trimming.
 */
public final class DocumentFilter {

    private DocumentFilter() {
    }

    public static boolean isEligible(final @Nullable ForumDocument document, final SearchSettings settings) {
        if (document == null || document.deleted()) {
            return false;
        }
        if (settings.isCategoryExcluded(document.categoryId())) {
            return false;
        }
        final String text = document.text();
        return text != null && !text.isBlank();
    }
}
