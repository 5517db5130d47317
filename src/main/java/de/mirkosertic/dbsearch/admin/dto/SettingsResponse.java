package de.mirkosertic.dbsearch.admin.dto;

import de.mirkosertic.dbsearch.sync.ProgressView;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything the admin page shows: limits, excluded categories, language choice, totals and progress.
 */
public record SettingsResponse(
        boolean success,
        int postLimit,
        int topicLimit,
        List<Long> excludeCategories,
        @Nullable String indexLanguage,
        List<LanguageOption> languages,
        /** Whether the engine honors the configured language. */
        boolean languageSupported,
        long topicCount,
        long postCount,
        /** Indexed topics, never more than {@link #topicCount()}. */
        long topicsIndexed,
        /** Indexed posts, never more than {@link #postCount()}. */
        long postsIndexed,
        @Nullable ProgressView progress,
        @Nullable String error
) {
    public static SettingsResponse error(final String errorMessage) {
        return new SettingsResponse(false, 0, 0, List.of(), null, List.of(), false,
                0, 0, 0, 0, null, errorMessage);
    }
}
