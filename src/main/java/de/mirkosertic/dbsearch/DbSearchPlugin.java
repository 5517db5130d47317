package de.mirkosertic.dbsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.dbsearch.admin.SearchAdminService;
import de.mirkosertic.dbsearch.config.ApplicationConfig;
import de.mirkosertic.dbsearch.settings.SearchSettings;
import de.mirkosertic.dbsearch.settings.SettingsBroadcast;
import de.mirkosertic.dbsearch.settings.SettingsPersistence;
import de.mirkosertic.dbsearch.settings.SettingsStore;
import de.mirkosertic.dbsearch.settings.SettingsUpdate;
import de.mirkosertic.dbsearch.settings.YamlSettingsPersistence;
import de.mirkosertic.dbsearch.sync.DocumentEvent;
import de.mirkosertic.dbsearch.sync.DocumentKind;
import de.mirkosertic.dbsearch.sync.DocumentStore;
import de.mirkosertic.dbsearch.sync.IndexSynchronizer;
import de.mirkosertic.dbsearch.sync.IndexingHook;
import de.mirkosertic.dbsearch.sync.MutationEventRouter;
import de.mirkosertic.dbsearch.sync.Post;
import de.mirkosertic.dbsearch.sync.ProgressReporter;
import de.mirkosertic.dbsearch.sync.ProgressView;
import de.mirkosertic.dbsearch.sync.SyncExecutorService;
import de.mirkosertic.dbsearch.sync.SyncStatisticsTracker;
import de.mirkosertic.dbsearch.sync.Topic;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the search plugin. Wires all services and exposes the operations the
 * host calls: document events, searches and the admin actions.
 */
public class DbSearchPlugin {

    private static final Logger logger = LoggerFactory.getLogger(DbSearchPlugin.class);

    private final DocumentStore documentStore;
    private final SearchIndex searchIndex;
    private final SettingsStore settingsStore;
    private final DocumentNormalizer normalizer;
    private final SyncExecutorService syncExecutor;
    private final SyncStatisticsTracker statisticsTracker;
    private final IndexSynchronizer synchronizer;
    private final MutationEventRouter eventRouter;
    private final SearchAdminService adminService;

    private volatile @Nullable String engineLanguage;

    public DbSearchPlugin(final ApplicationConfig config, final DocumentStore documentStore,
                          final SettingsBroadcast broadcast) {
        this(config, documentStore, new LuceneSearchIndex(config),
                new YamlSettingsPersistence(Path.of(config.getSettingsPath())), broadcast);
    }

    public DbSearchPlugin(final ApplicationConfig config, final DocumentStore documentStore,
                          final SearchIndex searchIndex, final SettingsPersistence persistence,
                          final SettingsBroadcast broadcast) {
        this.documentStore = documentStore;
        this.searchIndex = searchIndex;

        // Initialize services in dependency order
        this.settingsStore = new SettingsStore(persistence, broadcast, new ObjectMapper());
        this.normalizer = new DocumentNormalizer();
        this.syncExecutor = new SyncExecutorService(config);
        this.statisticsTracker = new SyncStatisticsTracker(config);

        this.synchronizer = new IndexSynchronizer(
                documentStore,
                searchIndex,
                settingsStore,
                normalizer,
                syncExecutor,
                statisticsTracker,
                config.getBatchSize()
        );

        this.eventRouter = new MutationEventRouter(synchronizer, documentStore);
        this.adminService = new SearchAdminService(synchronizer, settingsStore, documentStore);
    }

    /**
     * Loads the settings, subscribes to sibling broadcasts and opens the index.
     */
    public void init() throws IOException {
        logger.info("Initializing search plugin...");

        final SearchSettings settings = settingsStore.init();
        settingsStore.onRemoteUpdate(this::followLanguage);

        final String language = IndexLanguage.engineIdentifier(settings.indexLanguage(), searchIndex.acceptsLanguageCodes());
        searchIndex.createIndices(language);
        engineLanguage = language;

        logger.info("Search plugin initialized with index language {}", language);
    }

    public void onDocumentEvent(final DocumentEvent event) throws IOException {
        eventRouter.onDocumentEvent(event);
    }

    /**
     * Searches one index with the configured result limit of that index.
     *
     * @return matching identifiers; empty if the request names no index or has no criteria
     */
    public List<Long> filterSearchQuery(final @Nullable SearchRequest request) throws IOException {
        if (request == null || request.index() == null) {
            return List.of();
        }
        final DocumentKind kind = DocumentKind.fromIndexName(request.index());
        final SearchQuery query = new SearchQuery(request.categoryIds(), request.authorId(), request.contentText(),
                SearchQuery.MatchMode.fromMatchWords(request.matchWords()));
        if (!query.hasCriteria()) {
            return List.of();
        }
        return searchIndex.search(kind, query, settingsStore.current().limitFor(kind));
    }

    /**
     * Searches the posts of a single topic.
     */
    public List<Long> filterSearchTopic(final @Nullable String term, final long tid) throws IOException {
        if (term == null || term.isBlank() || tid <= 0) {
            return List.of();
        }
        final Topic topic = documentStore.getTopic(tid);
        if (topic == null) {
            return List.of();
        }

        final List<Long> pids = filterSearchQuery(new SearchRequest(DocumentKind.POST.indexName(),
                topic.cid() != null ? List.of(topic.cid()) : null, null, term, null));
        if (pids.isEmpty()) {
            return List.of();
        }

        final List<Long> result = new ArrayList<>();
        for (final Post post : documentStore.getPosts(pids)) {
            if (post != null && post.tid() == tid) {
                result.add(post.pid());
            }
        }
        return result;
    }

    public void fullReindex() throws IOException {
        synchronizer.fullReindex();
    }

    public void fullClear() throws IOException {
        synchronizer.fullClear();
    }

    public ProgressView checkProgress() throws IOException {
        return ProgressReporter.progress(settingsStore.readPersisted(), documentStore.getTotals());
    }

    public void saveSettings(final SettingsUpdate update) throws IOException {
        settingsStore.save(update);
    }

    public void changeIndexLanguage(final String languageCode) throws IOException {
        synchronizer.changeIndexLanguage(languageCode);
    }

    public void addIndexingHook(final IndexingHook hook) {
        synchronizer.addIndexingHook(hook);
    }

    public SearchAdminService admin() {
        return adminService;
    }

    public SettingsStore getSettingsStore() {
        return settingsStore;
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down search plugin...");

        // Shutdown in reverse order of initialization
        adminService.shutdown();
        statisticsTracker.shutdown();
        syncExecutor.shutdown();

        try {
            searchIndex.close();
        } catch (final IOException e) {
            logger.error("Error closing search index", e);
        }
        normalizer.close();

        logger.info("Search plugin shutdown complete");
    }

    private void followLanguage(final SearchSettings settings) {
        final String language = IndexLanguage.engineIdentifier(settings.indexLanguage(), searchIndex.acceptsLanguageCodes());
        if (language.equals(engineLanguage)) {
            return;
        }
        try {
            searchIndex.changeIndexLanguage(language);
            engineLanguage = language;
        } catch (final IndexEngineException e) {
            logger.error("Failed to follow index language change to {}", language, e);
        }
    }
}
