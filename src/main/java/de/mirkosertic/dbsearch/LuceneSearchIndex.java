package de.mirkosertic.dbsearch;

import de.mirkosertic.dbsearch.config.ApplicationConfig;
import de.mirkosertic.dbsearch.sync.DocumentKind;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lucene implementation of the index engine.
 * <p>
 * Topics and posts share one index and are told apart by the {@code kind} field; the
 * unique key of a record is {@code <kind>:<id>}. Every write refreshes the searcher before
 * it returns, so a search issued after a write observes it. Commits happen periodically
 * in the background and on {@link #close()}.
 */
public class LuceneSearchIndex implements SearchIndex {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSearchIndex.class);

    static final String FIELD_DOC_KEY = "doc_key";
    static final String FIELD_KIND = "kind";
    static final String FIELD_ID = "id";
    static final String FIELD_CID = "cid";
    static final String FIELD_UID = "uid";
    static final String FIELD_CONTENT = "content";

    private final Path indexPath;
    private final long commitIntervalMs;
    private final Map<String, Analyzer> analyzers = new ConcurrentHashMap<>();
    private final LanguageSwitchingAnalyzer analyzer;

    private Directory directory;
    private volatile IndexWriter indexWriter;
    private volatile SearcherManager searcherManager;
    private ScheduledExecutorService commitScheduler;
    private volatile String language;

    public LuceneSearchIndex(final ApplicationConfig config) {
        this(Path.of(config.getIndexPath()), config.getCommitIntervalMs());
    }

    public LuceneSearchIndex(final Path indexPath, final long commitIntervalMs) {
        this.indexPath = indexPath;
        this.commitIntervalMs = commitIntervalMs;
        this.language = IndexLanguage.ENGLISH.languageName();
        this.analyzer = new LanguageSwitchingAnalyzer(analyzerFor(language));
    }

    /**
     * Opens (or creates) the index. Calling it again on an open index only switches the language.
     */
    @Override
    public synchronized void createIndices(final String languageName) throws IndexEngineException {
        if (indexWriter != null) {
            changeIndexLanguage(languageName);
            return;
        }

        this.language = languageName;
        analyzer.switchTo(analyzerFor(languageName));
        try {
            if (!Files.exists(indexPath)) {
                Files.createDirectories(indexPath);
                logger.info("Created index directory: {}", indexPath.toAbsolutePath());
            }

            directory = FSDirectory.open(indexPath);
            final IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            indexWriter = new IndexWriter(directory, config);
            indexWriter.commit();

            searcherManager = new SearcherManager(indexWriter, null);
        } catch (final IOException e) {
            throw new IndexEngineException("Failed to open index at " + indexPath, e);
        }

        if (commitIntervalMs > 0) {
            commitScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "lucene-commit");
                t.setDaemon(true);
                return t;
            });
            commitScheduler.scheduleAtFixedRate(this::commitIfChanged,
                    commitIntervalMs, commitIntervalMs, TimeUnit.MILLISECONDS);
        }

        logger.info("Lucene index initialized at: {} with language {} and commit interval {}ms",
                indexPath.toAbsolutePath(), languageName, commitIntervalMs);
    }

    @Override
    public void changeIndexLanguage(final String languageName) {
        final String previous = this.language;
        this.language = languageName;
        analyzer.switchTo(analyzerFor(languageName));
        if (!previous.equals(languageName)) {
            logger.warn("Index language changed from {} to {}; records indexed before keep their old analysis "
                    + "until the next full reindex", previous, languageName);
        }
    }

    @Override
    public boolean acceptsLanguageCodes() {
        return false;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public void indexDocuments(final DocumentKind kind, final List<IndexRecord> records) throws IndexEngineException {
        if (records.isEmpty()) {
            return;
        }
        final IndexWriter writer = requireWriter();
        try {
            for (final IndexRecord record : records) {
                if (record.kind() != kind) {
                    throw new IndexEngineException("Record " + record.id() + " is a " + record.kind()
                            + ", not a " + kind);
                }
                writer.updateDocument(docKey(kind, record.id()), createDocument(record));
            }
            searcherManager.maybeRefreshBlocking();
        } catch (final IndexEngineException e) {
            throw e;
        } catch (final IOException | RuntimeException e) {
            throw new IndexEngineException("Failed to index " + records.size() + " " + kind.indexName() + " records", e);
        }
    }

    @Override
    public void removeDocuments(final DocumentKind kind, final Collection<Long> ids) throws IndexEngineException {
        if (ids.isEmpty()) {
            return;
        }
        final IndexWriter writer = requireWriter();
        final Term[] terms = new Term[ids.size()];
        int i = 0;
        for (final Long id : ids) {
            terms[i++] = docKey(kind, id);
        }
        try {
            writer.deleteDocuments(terms);
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException | RuntimeException e) {
            throw new IndexEngineException("Failed to remove " + ids.size() + " " + kind.indexName() + " records", e);
        }
    }

    @Override
    public List<Long> search(final DocumentKind kind, final SearchQuery query, final int limit) throws IndexEngineException {
        if (!query.hasCriteria() || limit <= 0) {
            return List.of();
        }
        requireWriter();

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(new TermQuery(new Term(FIELD_KIND, kind.indexName())), BooleanClause.Occur.FILTER);

        if (query.hasCategoryFilter()) {
            final BooleanQuery.Builder categories = new BooleanQuery.Builder();
            for (final Long cid : query.categoryIds()) {
                categories.add(new TermQuery(new Term(FIELD_CID, String.valueOf(cid))), BooleanClause.Occur.SHOULD);
            }
            builder.add(categories.build(), BooleanClause.Occur.FILTER);
        }

        if (query.authorId() != null) {
            builder.add(new TermQuery(new Term(FIELD_UID, String.valueOf(query.authorId()))), BooleanClause.Occur.FILTER);
        }

        if (query.hasContent()) {
            final BooleanClause.Occur operator = query.matchMode() == SearchQuery.MatchMode.ANY
                    ? BooleanClause.Occur.SHOULD
                    : BooleanClause.Occur.MUST;
            final Query contentQuery = new QueryBuilder(analyzer)
                    .createBooleanQuery(FIELD_CONTENT, query.contentText(), operator);
            if (contentQuery == null) {
                // Nothing searchable left after analysis (only punctuation or stop words)
                return List.of();
            }
            builder.add(contentQuery, BooleanClause.Occur.MUST);
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(builder.build(), limit);
                final List<Long> ids = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document doc = searcher.storedFields().document(scoreDoc.doc);
                    final IndexableField idField = doc.getField(FIELD_ID);
                    if (idField != null && idField.numericValue() != null) {
                        ids.add(idField.numericValue().longValue());
                    }
                }
                return ids;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException | RuntimeException e) {
            throw new IndexEngineException("Search against " + kind.indexName() + " index failed", e);
        }
    }

    /**
     * Number of records of the given kind currently visible to searches.
     */
    public int count(final DocumentKind kind) throws IndexEngineException {
        requireWriter();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(new TermQuery(new Term(FIELD_KIND, kind.indexName())));
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new IndexEngineException("Failed to count " + kind.indexName() + " records", e);
        }
    }

    public void commit() throws IndexEngineException {
        try {
            requireWriter().commit();
        } catch (final IOException e) {
            throw new IndexEngineException("Commit failed", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (commitScheduler != null) {
            commitScheduler.shutdown();
            try {
                if (!commitScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    commitScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                commitScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // Close SearcherManager before IndexWriter
        if (searcherManager != null) {
            searcherManager.close();
            searcherManager = null;
        }
        if (indexWriter != null) {
            indexWriter.close();
            indexWriter = null;
        }
        if (directory != null) {
            directory.close();
            directory = null;
        }
        analyzer.close();
        analyzers.values().forEach(Analyzer::close);
        analyzers.clear();
        logger.info("Lucene index closed");
    }

    private void commitIfChanged() {
        try {
            final IndexWriter writer = indexWriter;
            if (writer != null && writer.hasUncommittedChanges()) {
                writer.commit();
                logger.debug("Committed pending index changes");
            }
        } catch (final IOException | RuntimeException e) {
            // Must not throw: the scheduler cancels a periodic task that fails
            logger.warn("Periodic index commit failed", e);
        }
    }

    private IndexWriter requireWriter() throws IndexEngineException {
        final IndexWriter writer = indexWriter;
        if (writer == null) {
            throw new IndexEngineException("Index is not open; call createIndices first");
        }
        return writer;
    }

    private Analyzer analyzerFor(final String languageName) {
        return analyzers.computeIfAbsent(languageName, LanguageAnalyzer::forLanguageName);
    }

    private static Term docKey(final DocumentKind kind, final long id) {
        return new Term(FIELD_DOC_KEY, kind.indexName() + ":" + id);
    }

    private static Document createDocument(final IndexRecord record) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_DOC_KEY, record.kind().indexName() + ":" + record.id(), Field.Store.NO));
        doc.add(new StringField(FIELD_KIND, record.kind().indexName(), Field.Store.NO));
        doc.add(new StoredField(FIELD_ID, record.id()));
        if (record.categoryId() != null) {
            doc.add(new StringField(FIELD_CID, String.valueOf(record.categoryId()), Field.Store.NO));
        }
        doc.add(new StringField(FIELD_UID, String.valueOf(record.authorId()), Field.Store.NO));
        doc.add(new TextField(FIELD_CONTENT, record.content(), Field.Store.NO));
        return doc;
    }
}
