package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;

/**
 * A document lifecycle event with its payload. Post events carry a post, topic events a topic.
 */
public record DocumentEvent(
        DocumentEventType type,
        @Nullable Topic topic,
        @Nullable Post post
) {

    public static DocumentEvent of(final DocumentEventType type, final Post post) {
        return new DocumentEvent(type, null, post);
    }

    public static DocumentEvent of(final DocumentEventType type, final Topic topic) {
        return new DocumentEvent(type, topic, null);
    }

    Post requirePost() {
        if (post == null) {
            throw new InvalidInputException(type + " event without post payload");
        }
        return post;
    }

    Topic requireTopic() {
        if (topic == null) {
            throw new InvalidInputException(type + " event without topic payload");
        }
        return topic;
    }
}
