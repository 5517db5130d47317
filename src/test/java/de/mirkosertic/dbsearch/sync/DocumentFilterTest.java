package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.settings.SearchSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentFilter")
class DocumentFilterTest {

    private static final SearchSettings EXCLUDING_FIVE =
            new SearchSettings(500, 500, Set.of(5L), "en", 0, 0, false);

    @Test
    @DisplayName("Should accept a live document with text in an allowed category")
    void shouldAcceptEligibleDocument() {
        assertThat(DocumentFilter.isEligible(new Topic(1, 2L, 3, "Hello", false, 10), EXCLUDING_FIVE)).isTrue();
        assertThat(DocumentFilter.isEligible(new Post(10, 1, 2L, 3, "Body", false), EXCLUDING_FIVE)).isTrue();
    }

    @Test
    @DisplayName("Should reject deleted documents")
    void shouldRejectDeleted() {
        assertThat(DocumentFilter.isEligible(new Topic(1, 2L, 3, "Hello", true, 10), EXCLUDING_FIVE)).isFalse();
        assertThat(DocumentFilter.isEligible(new Post(10, 1, 2L, 3, "Body", true), EXCLUDING_FIVE)).isFalse();
    }

    @Test
    @DisplayName("Should reject documents in excluded categories")
    void shouldRejectExcludedCategory() {
        assertThat(DocumentFilter.isEligible(new Topic(1, 5L, 3, "Hello", false, 10), EXCLUDING_FIVE)).isFalse();
    }

    @Test
    @DisplayName("Should reject documents without text after trimming")
    void shouldRejectBlankText() {
        assertThat(DocumentFilter.isEligible(new Topic(1, 2L, 3, "   ", false, 10), EXCLUDING_FIVE)).isFalse();
        assertThat(DocumentFilter.isEligible(new Post(10, 1, 2L, 3, null, false), EXCLUDING_FIVE)).isFalse();
    }

    @Test
    @DisplayName("Should accept documents without category")
    void shouldAcceptMissingCategory() {
        assertThat(DocumentFilter.isEligible(new Post(10, 1, null, 3, "Body", false), EXCLUDING_FIVE)).isTrue();
    }

    @Test
    @DisplayName("Should reject null")
    void shouldRejectNull() {
        assertThat(DocumentFilter.isEligible(null, EXCLUDING_FIVE)).isFalse();
    }
}
