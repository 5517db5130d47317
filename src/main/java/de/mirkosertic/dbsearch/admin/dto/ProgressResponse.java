package de.mirkosertic.dbsearch.admin.dto;

import de.mirkosertic.dbsearch.sync.ProgressView;
import org.jspecify.annotations.Nullable;

public record ProgressResponse(
        boolean success,
        @Nullable ProgressView progress,
        @Nullable String error
) {
    public static ProgressResponse success(final ProgressView progress) {
        return new ProgressResponse(true, progress, null);
    }

    public static ProgressResponse error(final String errorMessage) {
        return new ProgressResponse(false, null, errorMessage);
    }
}
