package de.mirkosertic.dbsearch.settings;

import de.mirkosertic.dbsearch.sync.DocumentKind;
import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Process-wide search settings together with the shared progress counters.
 * <p>
 * Immutable; every change produces a new instance via {@link #merge(SettingsUpdate)}.
 */
public record SearchSettings(
        int postLimit,
        int topicLimit,
        Set<Long> excludeCategories,
        String indexLanguage,
        long topicsIndexed,
        long postsIndexed,
        boolean working
) {

    public static final int DEFAULT_POST_LIMIT = 500;
    public static final int DEFAULT_TOPIC_LIMIT = 500;
    public static final String DEFAULT_LANGUAGE = "en";

    public SearchSettings {
        excludeCategories = Set.copyOf(excludeCategories);
    }

    public static SearchSettings defaults() {
        return new SearchSettings(DEFAULT_POST_LIMIT, DEFAULT_TOPIC_LIMIT, Set.of(), DEFAULT_LANGUAGE, 0, 0, false);
    }

    /**
     * Result-set limit for searches against the given index.
     */
    public int limitFor(final DocumentKind kind) {
        return kind == DocumentKind.POST ? postLimit : topicLimit;
    }

    public boolean isCategoryExcluded(final @Nullable Long categoryId) {
        return categoryId != null && excludeCategories.contains(categoryId);
    }

    /**
     * Field-wise merge: every non-null field of {@code update} replaces the current value.
     */
    public SearchSettings merge(final SettingsUpdate update) {
        return new SearchSettings(
                update.postLimit() != null ? update.postLimit() : postLimit,
                update.topicLimit() != null ? update.topicLimit() : topicLimit,
                update.excludeCategories() != null ? update.excludeCategories() : excludeCategories,
                update.indexLanguage() != null ? update.indexLanguage() : indexLanguage,
                update.topicsIndexed() != null ? update.topicsIndexed() : topicsIndexed,
                update.postsIndexed() != null ? update.postsIndexed() : postsIndexed,
                update.working() != null ? update.working() : working
        );
    }
}
