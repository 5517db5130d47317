package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.DocumentNormalizer;
import de.mirkosertic.dbsearch.IndexLanguage;
import de.mirkosertic.dbsearch.IndexRecord;
import de.mirkosertic.dbsearch.SearchIndex;
import de.mirkosertic.dbsearch.settings.SearchSettings;
import de.mirkosertic.dbsearch.settings.SettingsStore;
import de.mirkosertic.dbsearch.settings.SettingsUpdate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the search index in step with the primary store.
 * <p>
 * Every operation is idempotent and may be re-run on the same input. Failures abort the
 * current operation and propagate; whatever was written before the failure stays in the
 * index and in the counters, and converges with the next full reindex or mutation.
 */
public class IndexSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(IndexSynchronizer.class);

    private final DocumentStore documentStore;
    private final SearchIndex searchIndex;
    private final SettingsStore settingsStore;
    private final DocumentNormalizer normalizer;
    private final BatchCursor batchCursor;
    private final SyncExecutorService executorService;
    private final SyncStatisticsTracker statisticsTracker;
    private final int batchSize;
    private final List<IndexingHook> indexingHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean fullRunActive = new AtomicBoolean(false);

    public IndexSynchronizer(final DocumentStore documentStore, final SearchIndex searchIndex,
                             final SettingsStore settingsStore, final DocumentNormalizer normalizer,
                             final SyncExecutorService executorService,
                             final SyncStatisticsTracker statisticsTracker, final int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidInputException("Batch size must be positive: " + batchSize);
        }
        this.documentStore = documentStore;
        this.searchIndex = searchIndex;
        this.settingsStore = settingsStore;
        this.normalizer = normalizer;
        this.batchCursor = new BatchCursor(documentStore);
        this.executorService = executorService;
        this.statisticsTracker = statisticsTracker;
        this.batchSize = batchSize;
    }

    public void addIndexingHook(final IndexingHook hook) {
        indexingHooks.add(hook);
    }

    /**
     * Indexes the eligible documents and removes the records of ineligible ones.
     * <p>
     * Posts without a category get the category of their parent topic. An identifier that
     * occurs more than once is indexed once, from its last occurrence. The indexed-counter
     * grows by the number of records actually written.
     *
     * @return number of records written
     */
    public int upsertDocuments(final DocumentKind kind, final List<? extends @Nullable ForumDocument> documents)
            throws IOException {
        final Map<Long, ForumDocument> unique = new LinkedHashMap<>();
        for (final ForumDocument document : documents) {
            if (document == null) {
                continue;
            }
            if (document.kind() != kind) {
                throw new InvalidInputException("Expected a " + kind.indexName() + " but got "
                        + document.kind().indexName() + " " + document.id());
            }
            unique.put(document.id(), document);
        }
        if (unique.isEmpty()) {
            return 0;
        }

        final List<ForumDocument> resolved = kind == DocumentKind.POST
                ? resolvePostCategories(unique.values())
                : new ArrayList<>(unique.values());

        final SearchSettings settings = settingsStore.current();
        final List<ForumDocument> eligible = new ArrayList<>();
        final List<Long> ineligibleIds = new ArrayList<>();
        for (final ForumDocument document : resolved) {
            if (DocumentFilter.isEligible(document, settings)) {
                eligible.add(document);
            } else {
                ineligibleIds.add(document.id());
            }
        }

        if (!ineligibleIds.isEmpty()) {
            // Drop stale records of documents that were deleted, emptied or moved to an excluded category
            searchIndex.removeDocuments(kind, ineligibleIds);
        }
        if (eligible.isEmpty()) {
            return 0;
        }

        List<IndexRecord> records = new ArrayList<>(eligible.size());
        for (final ForumDocument document : eligible) {
            records.add(new IndexRecord(kind, document.id(),
                    normalizer.normalize(document.text(), settings.indexLanguage()),
                    document.categoryId(), document.authorId()));
        }
        for (final IndexingHook hook : indexingHooks) {
            records = hook.beforeIndex(kind, List.copyOf(records), List.copyOf(eligible));
        }
        if (records.isEmpty()) {
            return 0;
        }

        searchIndex.indexDocuments(kind, records);
        settingsStore.incrementCounter(kind, records.size());
        return records.size();
    }

    /**
     * Removes the records with the given identifiers and decrements the indexed-counter by
     * the number of identifiers, whether or not they were indexed.
     */
    public void removeDocuments(final DocumentKind kind, final List<Long> ids) throws IOException {
        if (ids.isEmpty()) {
            return;
        }
        searchIndex.removeDocuments(kind, ids);
        settingsStore.incrementCounter(kind, -ids.size());
    }

    /**
     * Rebuilds the index from the complete primary store. Blocks until both the topic and the
     * post drive are done.
     *
     * @throws IllegalStateException if a full reindex or clear is already running in this process
     */
    public void fullReindex() throws IOException {
        beginFullRun("reindex");
        boolean success = false;
        try {
            settingsStore.markWorking(true, true);
            executorService.runAll(List.of(this::reindexAllTopics, this::reindexAllPosts));
            success = true;
        } finally {
            endFullRun(success, false);
        }
    }

    /**
     * Removes every topic and post of the primary store from the index and resets both
     * counters to exactly zero.
     *
     * @throws IllegalStateException if a full reindex or clear is already running in this process
     */
    public void fullClear() throws IOException {
        beginFullRun("clear");
        boolean success = false;
        try {
            settingsStore.markWorking(true, false);
            executorService.runAll(List.of(
                    () -> clearAll(DocumentKind.TOPIC),
                    () -> clearAll(DocumentKind.POST)));
            success = true;
        } finally {
            endFullRun(success, success);
        }
    }

    public boolean isFullRunActive() {
        return fullRunActive.get();
    }

    /**
     * Re-derives the records of the given topics, their main posts and all their child posts.
     * Deleted or missing topics are skipped.
     */
    public void reindexSubtree(final List<Long> tids) throws IOException {
        if (tids.isEmpty()) {
            throw new InvalidInputException("No topic ids to reindex");
        }

        final List<Topic> topics = new ArrayList<>();
        for (final Topic topic : documentStore.getTopics(tids)) {
            if (topic != null && !topic.deleted()) {
                topics.add(topic);
            }
        }
        if (topics.isEmpty()) {
            return;
        }

        upsertDocuments(DocumentKind.TOPIC, topics);
        for (final Topic topic : topics) {
            if (topic.mainPid() > 0) {
                reindexDocuments(List.of(topic.mainPid()), topic);
            }
            batchCursor.forEachBatch(childPostSet(topic.tid()), batchSize, pids -> reindexDocuments(pids, topic));
        }
    }

    /**
     * Re-indexes posts with the category of the given topic. Nothing happens if the topic is deleted.
     */
    public int reindexDocuments(final List<Long> pids, final Topic topic) throws IOException {
        if (pids.isEmpty()) {
            throw new InvalidInputException("No post ids to reindex for topic " + topic.tid());
        }
        if (topic.deleted()) {
            return 0;
        }

        final List<Post> posts = new ArrayList<>();
        for (final Post post : documentStore.getPosts(pids)) {
            if (post != null) {
                posts.add(post.withCategory(topic.cid()));
            }
        }
        return upsertDocuments(DocumentKind.POST, posts);
    }

    /**
     * Removes a topic, its main post and every child post from the index.
     */
    public void removeSubtree(final Topic topic) throws IOException {
        removeDocuments(DocumentKind.TOPIC, List.of(topic.tid()));
        if (topic.mainPid() > 0) {
            removeDocuments(DocumentKind.POST, List.of(topic.mainPid()));
        }
        batchCursor.forEachBatch(childPostSet(topic.tid()), batchSize,
                pids -> removeDocuments(DocumentKind.POST, pids));
    }

    /**
     * Switches the engine to a new language and persists the short code. Unknown codes are
     * passed to the engine as English when it needs full names.
     */
    public void changeIndexLanguage(final String languageCode) throws IOException {
        if (languageCode == null || languageCode.isBlank()) {
            throw new InvalidInputException("Language code must not be empty");
        }
        final String code = languageCode.trim();
        searchIndex.changeIndexLanguage(IndexLanguage.engineIdentifier(code, searchIndex.acceptsLanguageCodes()));
        settingsStore.save(SettingsUpdate.language(code));
        logger.info("Index language changed to {}", code);
    }

    private void reindexAllTopics() throws IOException {
        batchCursor.forEachBatch(DocumentKind.TOPIC.orderedSetName(), batchSize, tids -> {
            final int indexed = upsertDocuments(DocumentKind.TOPIC, documentStore.getTopics(tids));
            statisticsTracker.recordPage(DocumentKind.TOPIC, tids.size(), indexed);
        });
    }

    private void reindexAllPosts() throws IOException {
        batchCursor.forEachBatch(DocumentKind.POST.orderedSetName(), batchSize, pids -> {
            final List<Post> posts = new ArrayList<>();
            for (final Post post : documentStore.getPosts(pids)) {
                if (post != null && !post.deleted()) {
                    posts.add(post);
                }
            }

            final Map<Long, Topic> parents = loadTopics(posts);
            final List<Post> withLiveParent = new ArrayList<>();
            for (final Post post : posts) {
                final Topic parent = parents.get(post.tid());
                if (parent != null && !parent.deleted()) {
                    withLiveParent.add(post.withCategory(parent.cid()));
                }
            }

            final int indexed = upsertDocuments(DocumentKind.POST, withLiveParent);
            statisticsTracker.recordPage(DocumentKind.POST, pids.size(), indexed);
        });
    }

    private void clearAll(final DocumentKind kind) throws IOException {
        batchCursor.forEachBatch(kind.orderedSetName(), batchSize, ids -> {
            removeDocuments(kind, ids);
            statisticsTracker.recordPage(kind, ids.size(), ids.size());
        });
    }

    private List<ForumDocument> resolvePostCategories(final Iterable<ForumDocument> documents) throws IOException {
        final List<Post> withoutCategory = new ArrayList<>();
        for (final ForumDocument document : documents) {
            if (document.categoryId() == null) {
                withoutCategory.add((Post) document);
            }
        }
        final Map<Long, Topic> parents = withoutCategory.isEmpty() ? Map.of() : loadTopics(withoutCategory);

        final List<ForumDocument> resolved = new ArrayList<>();
        for (final ForumDocument document : documents) {
            if (document.categoryId() == null) {
                final Post post = (Post) document;
                final Topic parent = parents.get(post.tid());
                resolved.add(parent != null ? post.withCategory(parent.cid()) : post);
            } else {
                resolved.add(document);
            }
        }
        return resolved;
    }

    private Map<Long, Topic> loadTopics(final List<Post> posts) throws IOException {
        final Set<Long> tids = new LinkedHashSet<>();
        for (final Post post : posts) {
            tids.add(post.tid());
        }
        if (tids.isEmpty()) {
            return Map.of();
        }
        final List<Long> tidList = new ArrayList<>(tids);
        final List<@Nullable Topic> topics = documentStore.getTopics(tidList);
        final Map<Long, Topic> byTid = new HashMap<>();
        for (int i = 0; i < tidList.size() && i < topics.size(); i++) {
            final Topic topic = topics.get(i);
            if (topic != null) {
                byTid.put(tidList.get(i), topic);
            }
        }
        return byTid;
    }

    private void beginFullRun(final String mode) {
        if (!fullRunActive.compareAndSet(false, true)) {
            throw new IllegalStateException("A full reindex or clear is already running");
        }
        statisticsTracker.start(mode);
    }

    private void endFullRun(final boolean success, final boolean resetCounters) {
        try {
            settingsStore.markWorking(false, resetCounters);
        } catch (final IOException e) {
            // The working flag stays set until the next successful run
            logger.error("Failed to reset the working flag", e);
        } finally {
            statisticsTracker.finish(success);
            fullRunActive.set(false);
        }
    }

    private static String childPostSet(final long tid) {
        return "tid:" + tid + ":posts";
    }
}
