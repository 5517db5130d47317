package de.mirkosertic.dbsearch.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.dbsearch.DocumentNormalizer;
import de.mirkosertic.dbsearch.LuceneSearchIndex;
import de.mirkosertic.dbsearch.SearchQuery;
import de.mirkosertic.dbsearch.settings.InProcessSettingsBroadcast;
import de.mirkosertic.dbsearch.settings.SettingsStore;
import de.mirkosertic.dbsearch.settings.SettingsUpdate;
import de.mirkosertic.dbsearch.settings.YamlSettingsPersistence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MutationEventRouter")
class MutationEventRouterTest {

    private static final long CATEGORY_A = 1L;
    private static final long CATEGORY_B = 2L;

    @TempDir
    Path tempDir;

    private InMemoryDocumentStore store;
    private SettingsStore settingsStore;
    private LuceneSearchIndex index;
    private DocumentNormalizer normalizer;
    private SyncExecutorService executor;
    private SyncStatisticsTracker tracker;
    private MutationEventRouter router;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryDocumentStore();
        settingsStore = new SettingsStore(new YamlSettingsPersistence(tempDir.resolve("settings.yaml")),
                new InProcessSettingsBroadcast(), new ObjectMapper());
        settingsStore.init();
        index = new LuceneSearchIndex(tempDir.resolve("index"), 0);
        index.createIndices("english");
        normalizer = new DocumentNormalizer();
        executor = new SyncExecutorService(2);
        tracker = new SyncStatisticsTracker(0);
        final IndexSynchronizer synchronizer = new IndexSynchronizer(store, index, settingsStore, normalizer,
                executor, tracker, 2);
        router = new MutationEventRouter(synchronizer, store);

        store.addTopic(new Topic(1, CATEGORY_A, 3, "Apples and pears", false, 100))
                .addTopic(new Topic(2, CATEGORY_B, 3, "Bananas", false, 200))
                .addPost(new Post(100, 1, null, 3, "Apples are red", false))
                .addPost(new Post(101, 1, null, 4, "Pears are green", false))
                .addPost(new Post(200, 2, null, 3, "Bananas are yellow", false));
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdown();
        tracker.shutdown();
        normalizer.close();
        index.close();
    }

    private List<Long> postsInCategory(final long cid) throws IOException {
        return index.search(DocumentKind.POST, new SearchQuery(List.of(cid), null, null, null), 100);
    }

    private List<Long> postsMatching(final String text) throws IOException {
        return index.search(DocumentKind.POST, new SearchQuery(null, null, text, null), 100);
    }

    private void indexTopic(final long tid) throws IOException {
        router.onDocumentEvent(DocumentEvent.of(DocumentEventType.TOPIC_RESTORE, store.getTopic(tid)));
    }

    @Nested
    @DisplayName("Post events")
    class PostEventTests {

        @Test
        @DisplayName("Should index a saved post under the category of its topic")
        void shouldIndexSavedPost() throws IOException {
            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_SAVE,
                    new Post(101, 1, null, 4, "Pears are green", false)));

            assertThat(postsInCategory(CATEGORY_A)).containsExactly(101L);
            assertThat(settingsStore.readPersisted().postsIndexed()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not index a post whose topic is deleted")
        void shouldSkipPostOfDeletedTopic() throws IOException {
            store.updateTopic(new Topic(1, CATEGORY_A, 3, "Apples and pears", true, 100));

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_SAVE,
                    new Post(101, 1, null, 4, "Pears are green", false)));

            assertThat(postsMatching("pears")).isEmpty();
            assertThat(settingsStore.readPersisted().postsIndexed()).isZero();
        }

        @Test
        @DisplayName("Should drop an edited post that now lives in an excluded category")
        void shouldDropEditedPostInExcludedCategory() throws IOException {
            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_SAVE,
                    new Post(101, 1, null, 4, "Pears are green", false)));
            settingsStore.save(SettingsUpdate.limits(500, 500, Set.of(CATEGORY_A)));

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_EDIT,
                    new Post(101, 1, null, 4, "Pears are ripe", false)));

            assertThat(postsMatching("pears")).isEmpty();
        }

        @Test
        @DisplayName("Should remove deleted and purged posts")
        void shouldRemoveDeletedPost() throws IOException {
            indexTopic(1);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_DELETE,
                    new Post(101, 1, null, 4, "Pears are green", true)));
            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_PURGE,
                    new Post(100, 1, null, 3, "Apples are red", true)));

            assertThat(postsInCategory(CATEGORY_A)).isEmpty();
        }

        @Test
        @DisplayName("Should give a moved post the category of its new topic")
        void shouldRecategorizeMovedPost() throws IOException {
            indexTopic(1);
            final Post moved = new Post(101, 2, null, 4, "Pears are green", false);
            store.updatePost(moved);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_MOVE, moved));

            assertThat(postsInCategory(CATEGORY_A)).containsExactly(100L);
            assertThat(postsInCategory(CATEGORY_B)).containsExactly(101L);
        }

        @Test
        @DisplayName("Should drop the record of a post moved into a deleted topic")
        void shouldRemovePostMovedIntoDeletedTopic() throws IOException {
            indexTopic(1);
            store.updateTopic(new Topic(2, CATEGORY_B, 3, "Bananas", true, 200));
            final Post moved = new Post(101, 2, null, 4, "Pears are green", false);
            store.updatePost(moved);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_MOVE, moved));

            assertThat(postsInCategory(CATEGORY_A)).containsExactly(100L);
            assertThat(postsInCategory(CATEGORY_B)).isEmpty();
            assertThat(postsMatching("pears")).isEmpty();
        }

        @Test
        @DisplayName("Should skip a post moved to an unknown topic")
        void shouldSkipMoveToUnknownTopic() throws IOException {
            indexTopic(1);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_MOVE,
                    new Post(101, 99, null, 4, "Pears are green", false)));

            assertThat(postsInCategory(CATEGORY_A)).containsExactlyInAnyOrder(100L, 101L);
        }

        @Test
        @DisplayName("Should reject a post event without post")
        void shouldRejectMissingPost() {
            final DocumentEvent event = new DocumentEvent(DocumentEventType.POST_SAVE, null, null);

            assertThatThrownBy(() -> router.onDocumentEvent(event))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("post");
        }
    }

    @Nested
    @DisplayName("Topic events")
    class TopicEventTests {

        @Test
        @DisplayName("Should index a saved topic")
        void shouldIndexSavedTopic() throws IOException {
            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.TOPIC_SAVE, store.getTopic(2)));

            assertThat(index.search(DocumentKind.TOPIC, new SearchQuery(null, null, "bananas", null), 10))
                    .containsExactly(2L);
        }

        @Test
        @DisplayName("Should restore a topic with its main post and replies")
        void shouldRestoreSubtree() throws IOException {
            indexTopic(1);

            assertThat(index.count(DocumentKind.TOPIC)).isEqualTo(1);
            assertThat(postsInCategory(CATEGORY_A)).containsExactlyInAnyOrder(100L, 101L);
        }

        @Test
        @DisplayName("Should move every post of a moved topic to the new category")
        void shouldRecategorizeMovedTopic() throws IOException {
            indexTopic(1);
            final Topic moved = new Topic(1, CATEGORY_B, 3, "Apples and pears", false, 100);
            store.updateTopic(moved);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.TOPIC_MOVE, moved));

            assertThat(postsInCategory(CATEGORY_A)).isEmpty();
            assertThat(postsInCategory(CATEGORY_B)).containsExactlyInAnyOrder(100L, 101L);
        }

        @Test
        @DisplayName("Should remove a deleted topic with its main post and replies")
        void shouldRemoveDeletedTopic() throws IOException {
            indexTopic(1);
            indexTopic(2);

            router.onDocumentEvent(DocumentEvent.of(DocumentEventType.TOPIC_DELETE, store.getTopic(1)));

            assertThat(index.count(DocumentKind.TOPIC)).isEqualTo(1);
            assertThat(postsInCategory(CATEGORY_A)).isEmpty();
            assertThat(postsInCategory(CATEGORY_B)).containsExactly(200L);
        }

        @Test
        @DisplayName("Should reject a topic event without topic")
        void shouldRejectMissingTopic() {
            final DocumentEvent event = new DocumentEvent(DocumentEventType.TOPIC_PURGE, null, null);

            assertThatThrownBy(() -> router.onDocumentEvent(event))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("topic");
        }
    }
}
