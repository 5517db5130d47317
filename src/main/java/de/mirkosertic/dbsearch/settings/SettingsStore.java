package de.mirkosertic.dbsearch.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.dbsearch.sync.DocumentKind;
import de.mirkosertic.dbsearch.sync.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the search settings of this process.
 * <p>
 * The persisted record is the single authoritative copy. Each process keeps a cached
 * {@link SearchSettings} that is filled once by {@link #load()} and afterwards changed
 * only by local {@link #save(SettingsUpdate)} calls and by broadcasts from sibling processes,
 * which are merged field by field in the order they arrive. Reads through {@link #current()}
 * never touch storage.
 * <p>
 * The progress counters and the working flag are written straight to storage, because
 * several processes add to them concurrently; {@link #readPersisted()} returns their
 * latest stored values.
 */
public class SettingsStore {

    private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

    public static final String SETTINGS_KEY = "nodebb-plugin-dbsearch";
    public static final String SAVE_CHANNEL = "nodebb-plugin-dbsearch:settings:save";

    static final String FIELD_POST_LIMIT = "postLimit";
    static final String FIELD_TOPIC_LIMIT = "topicLimit";
    static final String FIELD_EXCLUDE_CATEGORIES = "excludeCategories";
    static final String FIELD_INDEX_LANGUAGE = "indexLanguage";
    static final String FIELD_WORKING = "working";

    private final SettingsPersistence persistence;
    private final SettingsBroadcast broadcast;
    private final ObjectMapper objectMapper;
    private final List<Consumer<SearchSettings>> remoteUpdateHandlers = new CopyOnWriteArrayList<>();

    private volatile SearchSettings current = SearchSettings.defaults();

    public SettingsStore(final SettingsPersistence persistence, final SettingsBroadcast broadcast,
                         final ObjectMapper objectMapper) {
        this.persistence = persistence;
        this.broadcast = broadcast;
        this.objectMapper = objectMapper;
    }

    /**
     * Subscribes to sibling broadcasts and loads the persisted settings.
     */
    public SearchSettings init() throws IOException {
        broadcast.subscribe(SAVE_CHANNEL, this::applyRemoteUpdate);
        return load();
    }

    /**
     * Reads the persisted settings, substituting defaults for missing fields, and makes
     * them the cached value of this process.
     */
    public SearchSettings load() throws IOException {
        final SearchSettings loaded = readPersisted();
        current = loaded;
        logger.info("Search settings loaded: postLimit={}, topicLimit={}, excludeCategories={}, language={}",
                loaded.postLimit(), loaded.topicLimit(), loaded.excludeCategories(), loaded.indexLanguage());
        return loaded;
    }

    /**
     * Reads the persisted settings without touching the cached value.
     */
    public SearchSettings readPersisted() throws IOException {
        final Map<String, Object> data = persistence.get(SETTINGS_KEY);
        return new SearchSettings(
                positiveInt(data.get(FIELD_POST_LIMIT), SearchSettings.DEFAULT_POST_LIMIT),
                positiveInt(data.get(FIELD_TOPIC_LIMIT), SearchSettings.DEFAULT_TOPIC_LIMIT),
                parseExcludeCategories(data.get(FIELD_EXCLUDE_CATEGORIES)),
                languageOrDefault(data.get(FIELD_INDEX_LANGUAGE)),
                longOrZero(data.get(DocumentKind.TOPIC.counterField())),
                longOrZero(data.get(DocumentKind.POST.counterField())),
                isTruthy(data.get(FIELD_WORKING))
        );
    }

    /**
     * The cached settings of this process.
     */
    public SearchSettings current() {
        return current;
    }

    /**
     * Persists the non-null fields of {@code update}, merges them into the cached settings
     * and broadcasts the resulting settings to all processes.
     *
     * @throws InvalidInputException if a limit is not positive; nothing is written in that case
     */
    public void save(final SettingsUpdate update) throws IOException {
        validate(update);

        final Map<String, Object> fields = new LinkedHashMap<>();
        if (update.postLimit() != null) {
            fields.put(FIELD_POST_LIMIT, update.postLimit());
        }
        if (update.topicLimit() != null) {
            fields.put(FIELD_TOPIC_LIMIT, update.topicLimit());
        }
        if (update.excludeCategories() != null) {
            fields.put(FIELD_EXCLUDE_CATEGORIES, serializeExcludeCategories(update.excludeCategories()));
        }
        if (update.indexLanguage() != null) {
            fields.put(FIELD_INDEX_LANGUAGE, update.indexLanguage());
        }
        if (update.topicsIndexed() != null) {
            fields.put(DocumentKind.TOPIC.counterField(), update.topicsIndexed());
        }
        if (update.postsIndexed() != null) {
            fields.put(DocumentKind.POST.counterField(), update.postsIndexed());
        }
        if (update.working() != null) {
            fields.put(FIELD_WORKING, update.working() ? 1 : 0);
        }
        final SearchSettings merged;
        synchronized (this) {
            persistence.set(SETTINGS_KEY, fields);
            merged = current.merge(update);
            current = merged;
        }
        // Published outside the lock: in-process subscribers of sibling stores take their own locks
        broadcast.publish(SAVE_CHANNEL, objectMapper.writeValueAsString(merged));
        logger.info("Search settings saved: {}", fields.keySet());
    }

    /**
     * Registers a callback invoked with the merged settings whenever a broadcast arrives.
     */
    public void onRemoteUpdate(final Consumer<SearchSettings> handler) {
        remoteUpdateHandlers.add(handler);
    }

    /**
     * Adds {@code delta} to the persisted indexed-counter of the given kind.
     */
    public long incrementCounter(final DocumentKind kind, final long delta) throws IOException {
        return persistence.incrementField(SETTINGS_KEY, kind.counterField(), delta);
    }

    /**
     * Sets the working flag and, if requested, resets both counters to exactly zero in the
     * same write.
     */
    public void markWorking(final boolean working, final boolean resetCounters) throws IOException {
        final Map<String, Object> fields = new LinkedHashMap<>();
        if (resetCounters) {
            fields.put(DocumentKind.TOPIC.counterField(), 0L);
            fields.put(DocumentKind.POST.counterField(), 0L);
        }
        fields.put(FIELD_WORKING, working ? 1 : 0);
        persistence.set(SETTINGS_KEY, fields);
    }

    private void applyRemoteUpdate(final String payload) {
        try {
            final SettingsUpdate update = objectMapper.readValue(payload, SettingsUpdate.class);
            final SearchSettings merged;
            synchronized (this) {
                merged = current.merge(update);
                current = merged;
            }
            logger.debug("Merged settings broadcast: {}", payload);
            for (final Consumer<SearchSettings> handler : remoteUpdateHandlers) {
                handler.accept(merged);
            }
        } catch (final JsonProcessingException e) {
            logger.error("Ignoring malformed settings broadcast: {}", payload, e);
        }
    }

    private static void validate(final SettingsUpdate update) {
        if (update.postLimit() != null && update.postLimit() <= 0) {
            throw new InvalidInputException("postLimit must be positive: " + update.postLimit());
        }
        if (update.topicLimit() != null && update.topicLimit() <= 0) {
            throw new InvalidInputException("topicLimit must be positive: " + update.topicLimit());
        }
        if ((update.topicsIndexed() != null && update.topicsIndexed() < 0)
                || (update.postsIndexed() != null && update.postsIndexed() < 0)) {
            throw new InvalidInputException("Indexed counters must not be negative");
        }
    }

    private String serializeExcludeCategories(final Set<Long> categories) throws JsonProcessingException {
        final List<String> values = new ArrayList<>();
        for (final Long cid : categories) {
            values.add(String.valueOf(cid));
        }
        return objectMapper.writeValueAsString(values);
    }

    /**
     * Accepts the JSON array string written by {@link #save(SettingsUpdate)} (numbers or numeric
     * strings) as well as a plain list. Anything malformed yields the empty set.
     */
    Set<Long> parseExcludeCategories(final Object raw) {
        if (raw == null) {
            return Set.of();
        }
        try {
            final JsonNode node = raw instanceof String
                    ? objectMapper.readTree((String) raw)
                    : objectMapper.valueToTree(raw);
            if (node == null || !node.isArray()) {
                logger.error("excludeCategories setting is not an array: {}, using none", raw);
                return Set.of();
            }
            final Set<Long> result = new LinkedHashSet<>();
            for (final JsonNode element : node) {
                result.add(Long.parseLong(element.asText().trim()));
            }
            return result;
        } catch (final JsonProcessingException | IllegalArgumentException e) {
            logger.error("Malformed excludeCategories setting {}, using none", raw, e);
            return Set.of();
        }
    }

    private static int positiveInt(final Object raw, final int defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        try {
            final int value = raw instanceof Number ? ((Number) raw).intValue() : Integer.parseInt(raw.toString().trim());
            return value > 0 ? value : defaultValue;
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring non-numeric limit {}", raw);
            return defaultValue;
        }
    }

    private static long longOrZero(final Object raw) {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (final NumberFormatException e) {
            return 0;
        }
    }

    private static String languageOrDefault(final Object raw) {
        if (raw == null || raw.toString().isBlank()) {
            return SearchSettings.DEFAULT_LANGUAGE;
        }
        return raw.toString().trim();
    }

    private static boolean isTruthy(final Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue() != 0;
        }
        return raw != null && ("1".equals(raw.toString().trim()) || "true".equalsIgnoreCase(raw.toString().trim()));
    }
}
