package de.mirkosertic.dbsearch;

import de.mirkosertic.dbsearch.config.ApplicationConfig;
import de.mirkosertic.dbsearch.settings.InProcessSettingsBroadcast;
import de.mirkosertic.dbsearch.settings.SettingsUpdate;
import de.mirkosertic.dbsearch.settings.YamlSettingsPersistence;
import de.mirkosertic.dbsearch.sync.DocumentEvent;
import de.mirkosertic.dbsearch.sync.DocumentEventType;
import de.mirkosertic.dbsearch.sync.InMemoryDocumentStore;
import de.mirkosertic.dbsearch.sync.InvalidInputException;
import de.mirkosertic.dbsearch.sync.Post;
import de.mirkosertic.dbsearch.sync.ProgressView;
import de.mirkosertic.dbsearch.sync.Topic;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DbSearchPlugin")
class DbSearchPluginTest {

    @TempDir
    Path tempDir;

    private InMemoryDocumentStore store;
    private InProcessSettingsBroadcast broadcast;
    private final List<DbSearchPlugin> plugins = new ArrayList<>();
    private DbSearchPlugin plugin;
    private LuceneSearchIndex index;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryDocumentStore();
        broadcast = new InProcessSettingsBroadcast();

        store.addTopic(new Topic(1, 1L, 3, "Raspberry cake recipe", false, 10))
                .addTopic(new Topic(2, 2L, 4, "Chocolate cake recipe", false, 20))
                .addPost(new Post(10, 1, null, 3, "Bake the raspberry cake for an hour", false))
                .addPost(new Post(11, 1, null, 4, "Raspberry jam works as well", false))
                .addPost(new Post(12, 1, null, 3, "Serve the cake cold", false))
                .addPost(new Post(20, 2, null, 4, "Melt the chocolate slowly", false));

        index = new LuceneSearchIndex(tempDir.resolve("index-1"), 0);
        plugin = startPlugin(index);
    }

    @AfterEach
    void tearDown() {
        plugins.forEach(DbSearchPlugin::shutdown);
    }

    private DbSearchPlugin startPlugin(final SearchIndex searchIndex) throws IOException {
        final ApplicationConfig config = ApplicationConfig.forDirectory(tempDir);
        final DbSearchPlugin started = new DbSearchPlugin(config, store, searchIndex,
                new YamlSettingsPersistence(Path.of(config.getSettingsPath())), broadcast);
        started.init();
        plugins.add(started);
        return started;
    }

    private static SearchRequest posts(final String text) {
        return SearchRequest.content("post", text);
    }

    @Nested
    @DisplayName("Searching")
    class SearchTests {

        @BeforeEach
        void indexEverything() throws IOException {
            plugin.fullReindex();
        }

        @Test
        @DisplayName("Should find posts by content")
        void shouldFindPostsByContent() throws IOException {
            assertThat(plugin.filterSearchQuery(posts("raspberry"))).containsExactlyInAnyOrder(10L, 11L);
            assertThat(plugin.filterSearchQuery(SearchRequest.content("topic", "chocolate"))).containsExactly(2L);
        }

        @Test
        @DisplayName("Should combine words with all by default and with any on request")
        void shouldHonorMatchWords() throws IOException {
            assertThat(plugin.filterSearchQuery(posts("raspberry chocolate"))).isEmpty();
            assertThat(plugin.filterSearchQuery(new SearchRequest("post", null, null, "raspberry chocolate", "any")))
                    .containsExactlyInAnyOrder(10L, 11L, 20L);
        }

        @Test
        @DisplayName("Should filter by category and author")
        void shouldFilterByCategoryAndAuthor() throws IOException {
            assertThat(plugin.filterSearchQuery(new SearchRequest("post", List.of(2L), null, null, null)))
                    .containsExactly(20L);
            assertThat(plugin.filterSearchQuery(new SearchRequest("post", List.of(1L), 4L, null, null)))
                    .containsExactly(11L);
        }

        @Test
        @DisplayName("Should cap results at the configured limit")
        void shouldApplyLimit() throws IOException {
            plugin.saveSettings(SettingsUpdate.limits(2, 500, Set.of()));

            assertThat(plugin.filterSearchQuery(new SearchRequest("post", List.of(1L), null, null, null))).hasSize(2);
        }

        @Test
        @DisplayName("Should return nothing for requests without index or criteria")
        void shouldReturnNothingWithoutCriteria() throws IOException {
            assertThat(plugin.filterSearchQuery(null)).isEmpty();
            assertThat(plugin.filterSearchQuery(new SearchRequest(null, null, null, "cake", null))).isEmpty();
            assertThat(plugin.filterSearchQuery(new SearchRequest("post", List.of(), null, "  ", null))).isEmpty();
        }

        @Test
        @DisplayName("Should reject unknown index names")
        void shouldRejectUnknownIndex() {
            assertThatThrownBy(() -> plugin.filterSearchQuery(SearchRequest.content("user", "cake")))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Should search within a single topic")
        void shouldSearchWithinTopic() throws IOException {
            assertThat(plugin.filterSearchTopic("cake", 1)).containsExactlyInAnyOrder(10L, 12L);
            assertThat(plugin.filterSearchTopic("chocolate", 1)).isEmpty();
            assertThat(plugin.filterSearchTopic("cake", 99)).isEmpty();
            assertThat(plugin.filterSearchTopic(" ", 1)).isEmpty();
        }

        @Test
        @DisplayName("Should report complete progress after a reindex")
        void shouldReportProgress() throws IOException {
            final ProgressView progress = plugin.checkProgress();

            assertThat(progress.topicsPercent()).isEqualTo(100.0);
            assertThat(progress.postsPercent()).isEqualTo(100.0);
            assertThat(progress.working()).isFalse();
        }
    }

    @Nested
    @DisplayName("Document events")
    class EventTests {

        @Test
        @DisplayName("Should make a saved post searchable at once")
        void shouldIndexSavedPost() throws IOException {
            final Post post = new Post(13, 1, null, 5, "Add fresh mint leaves", false);
            store.addPost(post);

            plugin.onDocumentEvent(DocumentEvent.of(DocumentEventType.POST_SAVE, post));

            assertThat(plugin.filterSearchQuery(posts("mint"))).containsExactly(13L);
        }

        @Test
        @DisplayName("Should pass records through registered indexing hooks")
        void shouldApplyIndexingHook() throws IOException {
            plugin.addIndexingHook((kind, records, documents) -> {
                final List<IndexRecord> tagged = new ArrayList<>();
                for (final IndexRecord record : records) {
                    tagged.add(new IndexRecord(record.kind(), record.id(), record.content() + " featured",
                            record.categoryId(), record.authorId()));
                }
                return tagged;
            });

            plugin.onDocumentEvent(DocumentEvent.of(DocumentEventType.TOPIC_SAVE, store.getTopic(1)));

            assertThat(plugin.filterSearchQuery(SearchRequest.content("topic", "featured"))).containsExactly(1L);
        }
    }

    @Nested
    @DisplayName("Index language")
    class LanguageTests {

        @Test
        @DisplayName("Should persist the language code and open later instances with it")
        void shouldPersistLanguage() throws IOException {
            plugin.changeIndexLanguage("de");

            assertThat(index.getLanguage()).isEqualTo("german");
            final LuceneSearchIndex laterIndex = new LuceneSearchIndex(tempDir.resolve("index-2"), 0);
            final DbSearchPlugin later = startPlugin(laterIndex);
            assertThat(later.getSettingsStore().current().indexLanguage()).isEqualTo("de");
            assertThat(laterIndex.getLanguage()).isEqualTo("german");
        }

        @Test
        @DisplayName("Should make sibling instances follow a language change")
        void shouldPropagateToSiblings() throws IOException {
            final LuceneSearchIndex siblingIndex = new LuceneSearchIndex(tempDir.resolve("index-2"), 0);
            final DbSearchPlugin sibling = startPlugin(siblingIndex);

            plugin.changeIndexLanguage("es");

            assertThat(sibling.getSettingsStore().current().indexLanguage()).isEqualTo("es");
            assertThat(siblingIndex.getLanguage()).isEqualTo("spanish");
        }
    }
}
