package de.mirkosertic.dbsearch.admin;

import de.mirkosertic.dbsearch.IndexLanguage;
import de.mirkosertic.dbsearch.admin.dto.LanguageOption;
import de.mirkosertic.dbsearch.admin.dto.ProgressResponse;
import de.mirkosertic.dbsearch.admin.dto.SettingsResponse;
import de.mirkosertic.dbsearch.admin.dto.SimpleMessageResponse;
import de.mirkosertic.dbsearch.settings.SearchSettings;
import de.mirkosertic.dbsearch.settings.SettingsStore;
import de.mirkosertic.dbsearch.settings.SettingsUpdate;
import de.mirkosertic.dbsearch.sync.DocumentStore;
import de.mirkosertic.dbsearch.sync.IndexSynchronizer;
import de.mirkosertic.dbsearch.sync.IndexTotals;
import de.mirkosertic.dbsearch.sync.InvalidInputException;
import de.mirkosertic.dbsearch.sync.ProgressReporter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operations behind the search admin page.
 * <p>
 * Reindex and clear are started on a background thread and return at once; their progress
 * is observed through {@link #checkProgress()}. All operations report failures through
 * their response record instead of throwing.
 */
public class SearchAdminService {

    private static final Logger logger = LoggerFactory.getLogger(SearchAdminService.class);

    private final IndexSynchronizer synchronizer;
    private final SettingsStore settingsStore;
    private final DocumentStore documentStore;
    private final AtomicBoolean operationPending = new AtomicBoolean(false);

    // Single-threaded executor for full runs (ensures only one runs at a time)
    private final ExecutorService adminExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "dbsearch-admin-ops");
        t.setDaemon(true);
        return t;
    });

    public SearchAdminService(final IndexSynchronizer synchronizer, final SettingsStore settingsStore,
                              final DocumentStore documentStore) {
        this.synchronizer = synchronizer;
        this.settingsStore = settingsStore;
        this.documentStore = documentStore;
    }

    public SimpleMessageResponse reindex() {
        return startFullRun("Reindex", synchronizer::fullReindex);
    }

    public SimpleMessageResponse clearIndex() {
        return startFullRun("Index clear", synchronizer::fullClear);
    }

    /**
     * Whether a reindex or clear started through this service has not finished yet.
     */
    public boolean isOperationPending() {
        return operationPending.get();
    }

    public ProgressResponse checkProgress() {
        try {
            return ProgressResponse.success(ProgressReporter.progress(settingsStore.readPersisted(),
                    documentStore.getTotals()));
        } catch (final IOException e) {
            logger.error("Failed to compute indexing progress", e);
            return ProgressResponse.error("Failed to compute progress: " + e.getMessage());
        }
    }

    /**
     * Saves result limits and excluded categories as entered on the admin page.
     */
    public SimpleMessageResponse saveSettings(final @Nullable String postLimit, final @Nullable String topicLimit,
                                              final @Nullable List<String> excludeCategories) {
        final Integer posts = parseLimit(postLimit);
        final Integer topics = parseLimit(topicLimit);
        if (posts == null || topics == null) {
            logger.warn("Rejected settings with non-numeric limits: postLimit={}, topicLimit={}", postLimit, topicLimit);
            return SimpleMessageResponse.error("postLimit and topicLimit must be numbers");
        }

        final Set<Long> categories = new LinkedHashSet<>();
        if (excludeCategories != null) {
            for (final String cid : excludeCategories) {
                try {
                    categories.add(Long.parseLong(String.valueOf(cid).trim()));
                } catch (final NumberFormatException e) {
                    logger.warn("Rejected settings with invalid category id: {}", cid);
                    return SimpleMessageResponse.error("Invalid category id: " + cid);
                }
            }
        }

        try {
            settingsStore.save(SettingsUpdate.limits(posts, topics, categories));
            return SimpleMessageResponse.success("Settings saved!");
        } catch (final InvalidInputException e) {
            logger.warn("Rejected settings: {}", e.getMessage());
            return SimpleMessageResponse.error(e.getMessage());
        } catch (final IOException e) {
            logger.error("Failed to save settings", e);
            return SimpleMessageResponse.error("Failed to save settings: " + e.getMessage());
        }
    }

    public SimpleMessageResponse changeLanguage(final @Nullable String languageCode) {
        try {
            synchronizer.changeIndexLanguage(languageCode);
            return SimpleMessageResponse.success("Index language changed to " + languageCode.trim()
                    + ". Reindex to apply it to existing content.");
        } catch (final InvalidInputException e) {
            logger.warn("Rejected language change: {}", e.getMessage());
            return SimpleMessageResponse.error(e.getMessage());
        } catch (final IOException e) {
            logger.error("Failed to change index language to {}", languageCode, e);
            return SimpleMessageResponse.error("Failed to change language: " + e.getMessage());
        }
    }

    public SettingsResponse getSettings() {
        try {
            final SearchSettings settings = settingsStore.readPersisted();
            final IndexTotals totals = documentStore.getTotals();

            final List<LanguageOption> languages = new ArrayList<>();
            for (final IndexLanguage language : IndexLanguage.values()) {
                languages.add(new LanguageOption(language.languageName(), language.code(),
                        language.code().equals(settings.indexLanguage())));
            }

            final List<Long> excluded = new ArrayList<>(settings.excludeCategories());
            excluded.sort(null);

            return new SettingsResponse(
                    true,
                    settings.postLimit(),
                    settings.topicLimit(),
                    excluded,
                    settings.indexLanguage(),
                    languages,
                    true,
                    totals.topicCount(),
                    totals.postCount(),
                    Math.min(settings.topicsIndexed(), totals.topicCount()),
                    Math.min(settings.postsIndexed(), totals.postCount()),
                    ProgressReporter.progress(settings, totals),
                    null
            );
        } catch (final IOException e) {
            logger.error("Failed to read search settings", e);
            return SettingsResponse.error("Failed to read settings: " + e.getMessage());
        }
    }

    public void shutdown() {
        adminExecutor.shutdown();
        try {
            if (!adminExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                adminExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            adminExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private SimpleMessageResponse startFullRun(final String name, final FullRun run) {
        if (synchronizer.isFullRunActive() || !operationPending.compareAndSet(false, true)) {
            return SimpleMessageResponse.error("A full reindex or clear is already running");
        }

        try {
            adminExecutor.submit(() -> {
                try {
                    run.execute();
                } catch (final IOException | RuntimeException e) {
                    logger.error("{} failed", name, e);
                } finally {
                    operationPending.set(false);
                }
            });
        } catch (final RejectedExecutionException e) {
            operationPending.set(false);
            logger.warn("{} rejected: admin service is shut down", name);
            return SimpleMessageResponse.error(name + " rejected: service is shut down");
        }
        return SimpleMessageResponse.success(name + " started");
    }

    private static @Nullable Integer parseLimit(final @Nullable String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    @FunctionalInterface
    private interface FullRun {
        void execute() throws IOException;
    }
}
