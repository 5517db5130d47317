package de.mirkosertic.dbsearch.admin.dto;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of an admin action that carries no data besides a message.
 */
public record SimpleMessageResponse(
        boolean success,
        @Nullable String message,
        @Nullable String error
) {
    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
