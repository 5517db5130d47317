package de.mirkosertic.dbsearch.sync;

import org.jspecify.annotations.Nullable;

public record Post(
        long pid,
        long tid,
        /** Effective category, copied from the parent topic. */
        @Nullable Long cid,
        long uid,
        @Nullable String content,
        boolean deleted
) implements ForumDocument {

    @Override
    public DocumentKind kind() {
        return DocumentKind.POST;
    }

    @Override
    public long id() {
        return pid;
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
        return content;
    }

    /**
     * Returns a copy of this post that carries the given effective category.
     */
    public Post withCategory(final @Nullable Long categoryId) {
        return new Post(pid, tid, categoryId, uid, content, deleted);
    }
}
