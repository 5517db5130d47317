package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;

public record Topic(
        long tid,
        @Nullable Long cid,
        long uid,
        @Nullable String title,
        boolean deleted,
        /** Identifier of the first post of the topic, {@code 0} if unknown. */
        long mainPid
) implements ForumDocument {

    @Override
    public DocumentKind kind() {
        return DocumentKind.TOPIC;
    }

    @Override
    public long id() {
        return tid;
    }

    @Override
    public @Nullable Long categoryId() {
        return cid;
    }

    @Override
    public long authorId() {
        return uid;
    }

    @Override
    public @Nullable String text() {
        return title;
    }
}
