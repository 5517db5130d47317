package de.mirkosertic.dbsearch.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Maps document lifecycle events onto synchronizer operations.
 * <p>
 * A post takes its effective category from its parent topic, which is looked up in the
 * primary store at the time the event is handled. Posts of deleted topics are never indexed,
 * and a post moved into a deleted topic loses its record.
 * Events for the same document must be delivered in the order they happened.
 */
public class MutationEventRouter {

    private static final Logger logger = LoggerFactory.getLogger(MutationEventRouter.class);

    private final IndexSynchronizer synchronizer;
    private final DocumentStore documentStore;

    public MutationEventRouter(final IndexSynchronizer synchronizer, final DocumentStore documentStore) {
        this.synchronizer = synchronizer;
        this.documentStore = documentStore;
    }

    public void onDocumentEvent(final DocumentEvent event) throws IOException {
        switch (event.type()) {
            case POST_SAVE, POST_EDIT, POST_RESTORE -> savePost(event.requirePost());
            case POST_DELETE, POST_PURGE ->
                    synchronizer.removeDocuments(DocumentKind.POST, List.of(event.requirePost().pid()));
            case POST_MOVE -> movePost(event.requirePost());
            case TOPIC_SAVE, TOPIC_EDIT -> synchronizer.upsertDocuments(DocumentKind.TOPIC, List.of(event.requireTopic()));
            case TOPIC_RESTORE, TOPIC_MOVE -> synchronizer.reindexSubtree(List.of(event.requireTopic().tid()));
            case TOPIC_DELETE, TOPIC_PURGE -> synchronizer.removeSubtree(event.requireTopic());
            default -> throw new InvalidInputException("Unsupported event type: " + event.type());
        }
    }

    private void savePost(final Post post) throws IOException {
        final Topic parent = documentStore.getTopic(post.tid());
        if (parent == null || parent.deleted()) {
            logger.debug("Not indexing post {}: parent topic {} is missing or deleted", post.pid(), post.tid());
            return;
        }
        synchronizer.upsertDocuments(DocumentKind.POST, List.of(post.withCategory(parent.cid())));
    }

    private void movePost(final Post post) throws IOException {
        final Topic newParent = documentStore.getTopic(post.tid());
        if (newParent == null) {
            logger.warn("Post {} moved to unknown topic {}, skipping", post.pid(), post.tid());
            return;
        }
        if (newParent.deleted()) {
            // The old record would stay searchable under the previous category
            synchronizer.removeDocuments(DocumentKind.POST, List.of(post.pid()));
            return;
        }
        synchronizer.reindexDocuments(List.of(post.pid()), newParent);
    }
}
