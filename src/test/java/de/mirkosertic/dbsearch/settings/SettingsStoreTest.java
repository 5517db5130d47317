package de.mirkosertic.dbsearch.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.dbsearch.sync.DocumentKind;
import de.mirkosertic.dbsearch.sync.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SettingsStore")
class SettingsStoreTest {

    @TempDir
    Path tempDir;

    private YamlSettingsPersistence persistence;
    private InProcessSettingsBroadcast broadcast;
    private SettingsStore store;

    @BeforeEach
    void setUp() {
        persistence = new YamlSettingsPersistence(tempDir.resolve("settings.yaml"));
        broadcast = new InProcessSettingsBroadcast();
        store = new SettingsStore(persistence, broadcast, new ObjectMapper());
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Should substitute defaults for an empty record")
        void shouldUseDefaults() throws IOException {
            assertThat(store.init()).isEqualTo(SearchSettings.defaults());
        }

        @Test
        @DisplayName("Should read the persisted representation")
        void shouldReadPersistedValues() throws IOException {
            persistence.set(SettingsStore.SETTINGS_KEY, Map.of(
                    "postLimit", "25",
                    "topicLimit", 30,
                    "excludeCategories", "[\"3\",\"7\"]",
                    "indexLanguage", "de",
                    "topicsIndexed", "12",
                    "postsIndexed", 40,
                    "working", 1));

            final SearchSettings settings = store.load();

            assertThat(settings).isEqualTo(new SearchSettings(25, 30, Set.of(3L, 7L), "de", 12, 40, true));
            assertThat(store.current()).isEqualTo(settings);
        }

        @Test
        @DisplayName("Should treat malformed excluded categories as none")
        void shouldRecoverFromMalformedCategories() throws IOException {
            persistence.set(SettingsStore.SETTINGS_KEY, Map.of("excludeCategories", "[not json"));

            assertThat(store.load().excludeCategories()).isEmpty();
        }

        @Test
        @DisplayName("Should treat a non-array excluded categories value as none")
        void shouldRecoverFromNonArrayCategories() {
            assertThat(store.parseExcludeCategories("{\"a\":1}")).isEmpty();
            assertThat(store.parseExcludeCategories("[\"x\"]")).isEmpty();
        }

        @Test
        @DisplayName("Should accept plain lists of category ids")
        void shouldAcceptPlainLists() {
            assertThat(store.parseExcludeCategories(List.of(1, "2"))).containsExactlyInAnyOrder(1L, 2L);
        }
    }

    @Nested
    @DisplayName("Saving")
    class SavingTests {

        @Test
        @DisplayName("Should persist limits and categories in the stored format")
        void shouldPersist() throws IOException {
            store.init();

            store.save(SettingsUpdate.limits(10, 20, Set.of(5L)));

            final Map<String, Object> stored = persistence.get(SettingsStore.SETTINGS_KEY);
            assertThat(stored).containsEntry("postLimit", 10).containsEntry("topicLimit", 20)
                    .containsEntry("excludeCategories", "[\"5\"]");
            assertThat(store.current().excludeCategories()).containsExactly(5L);
            assertThat(store.readPersisted().postLimit()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should reject non-positive limits without writing anything")
        void shouldRejectInvalidLimits() throws IOException {
            store.init();

            assertThatThrownBy(() -> store.save(SettingsUpdate.limits(0, 20, Set.of())))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(persistence.get(SettingsStore.SETTINGS_KEY)).isEmpty();
            assertThat(store.current()).isEqualTo(SearchSettings.defaults());
        }

        @Test
        @DisplayName("Should update sibling processes through the broadcast")
        void shouldBroadcastToSiblings() throws IOException {
            final SettingsStore sibling = new SettingsStore(persistence, broadcast, new ObjectMapper());
            store.init();
            sibling.init();
            final List<SearchSettings> received = new ArrayList<>();
            sibling.onRemoteUpdate(received::add);

            store.save(SettingsUpdate.limits(42, 43, Set.of(9L)));

            assertThat(sibling.current().postLimit()).isEqualTo(42);
            assertThat(sibling.current().topicLimit()).isEqualTo(43);
            assertThat(sibling.current().excludeCategories()).containsExactly(9L);
            assertThat(received).hasSize(1);
        }

        @Test
        @DisplayName("Should ignore malformed broadcasts")
        void shouldIgnoreMalformedBroadcast() throws IOException {
            store.init();

            broadcast.publish(SettingsStore.SAVE_CHANNEL, "{broken");

            assertThat(store.current()).isEqualTo(SearchSettings.defaults());
        }

        @Test
        @DisplayName("Should merge partial broadcasts field by field")
        void shouldMergePartialBroadcast() throws IOException {
            store.init();

            broadcast.publish(SettingsStore.SAVE_CHANNEL, "{\"indexLanguage\":\"fr\",\"unknownField\":true}");

            assertThat(store.current().indexLanguage()).isEqualTo("fr");
            assertThat(store.current().postLimit()).isEqualTo(SearchSettings.DEFAULT_POST_LIMIT);
        }
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("Should add deltas to the persisted counters")
        void shouldIncrementCounters() throws IOException {
            store.incrementCounter(DocumentKind.TOPIC, 3);
            store.incrementCounter(DocumentKind.TOPIC, -1);
            store.incrementCounter(DocumentKind.POST, 7);

            final SearchSettings persisted = store.readPersisted();
            assertThat(persisted.topicsIndexed()).isEqualTo(2);
            assertThat(persisted.postsIndexed()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should reset counters together with the working flag")
        void shouldResetCountersWithWorkingFlag() throws IOException {
            store.incrementCounter(DocumentKind.POST, 7);

            store.markWorking(true, true);
            assertThat(store.readPersisted().working()).isTrue();
            assertThat(store.readPersisted().postsIndexed()).isZero();

            store.incrementCounter(DocumentKind.POST, 2);
            store.markWorking(false, false);
            assertThat(store.readPersisted().working()).isFalse();
            assertThat(store.readPersisted().postsIndexed()).isEqualTo(2);
        }
    }
}
