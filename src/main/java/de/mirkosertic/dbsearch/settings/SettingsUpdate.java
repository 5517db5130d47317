package de.mirkosertic.dbsearch.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Partial settings record. {@code null} fields are left untouched when merged.
 * <p>
 * Also the wire format of settings broadcasts: a broadcast carries the complete settings,
 * and receivers merge it field by field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettingsUpdate(
        @Nullable Integer postLimit,
        @Nullable Integer topicLimit,
        @Nullable Set<Long> excludeCategories,
        @Nullable String indexLanguage,
        @Nullable Long topicsIndexed,
        @Nullable Long postsIndexed,
        @Nullable Boolean working
) {

    public static SettingsUpdate limits(final int postLimit, final int topicLimit, final Set<Long> excludeCategories) {
        return new SettingsUpdate(postLimit, topicLimit, excludeCategories, null, null, null, null);
    }

    public static SettingsUpdate language(final String indexLanguage) {
        return new SettingsUpdate(null, null, null, indexLanguage, null, null, null);
    }
}
