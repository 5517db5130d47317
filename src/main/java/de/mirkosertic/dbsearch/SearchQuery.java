package de.mirkosertic.dbsearch;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Criteria of an index search. All given criteria must match.
 */
public record SearchQuery(
        @Nullable List<Long> categoryIds,
        @Nullable Long authorId,
        @Nullable String contentText,
        MatchMode matchMode
) {

    /**
     * How the words of {@link #contentText()} are combined.
     */
    public enum MatchMode {
        ALL,
        ANY;

        /**
         * Parses the {@code matchWords} request value; anything other than {@code any} means all words.
         */
        public static MatchMode fromMatchWords(final @Nullable String matchWords) {
            return matchWords != null && "any".equals(matchWords.trim().toLowerCase(Locale.ROOT)) ? ANY : ALL;
        }
    }

    public SearchQuery {
        categoryIds = categoryIds != null ? List.copyOf(categoryIds) : null;
        matchMode = matchMode != null ? matchMode : MatchMode.ALL;
    }

    public boolean hasCategoryFilter() {
        return categoryIds != null && !categoryIds.isEmpty();
    }

    public boolean hasContent() {
        return contentText != null && !contentText.isBlank();
    }

    public boolean hasCriteria() {
        return hasCategoryFilter() || authorId != null || hasContent();
    }
}
