package de.mirkosertic.dbsearch.sync;

/**
 * Lifecycle events of forum documents that the host delivers to the search core.
 */
public enum DocumentEventType {

    POST_SAVE,
    POST_EDIT,
    POST_RESTORE,
    POST_DELETE,
    POST_PURGE,
    POST_MOVE,
    TOPIC_SAVE,
    TOPIC_EDIT,
    TOPIC_RESTORE,
    TOPIC_MOVE,
    TOPIC_DELETE,
    TOPIC_PURGE
}
