package de.mirkosertic.dbsearch.admin.dto;

/**
 * One entry of the index language selection.
 */
public record LanguageOption(
        String name,
        /** Short code that is persisted when this entry is chosen. */
        String value,
        boolean selected
) {
}
