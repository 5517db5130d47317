package de.mirkosertic.dbsearch.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Process configuration of the search plugin.
 * <p>
 * Sources, later ones winning:
 * <ol>
 *     <li>{@code application.yaml} on the classpath</li>
 *     <li>{@code ~/.dbsearch/config.yaml}</li>
 *     <li>system property {@code dbsearch.index.path}</li>
 *     <li>environment variables {@code DBSEARCH_INDEX_PATH} and {@code DBSEARCH_SETTINGS_PATH}</li>
 * </ol>
 * String values may contain {@code ${NAME:default}} placeholders, resolved against the
 * environment and then the system properties.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ROOT_KEY = "dbsearch";
    private static final String ENV_INDEX_PATH = "DBSEARCH_INDEX_PATH";
    private static final String ENV_SETTINGS_PATH = "DBSEARCH_SETTINGS_PATH";
    private static final String PROP_INDEX_PATH = "dbsearch.index.path";
    private static final String CONFIG_DIR = ".dbsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String BUNDLED_CONFIG_FILE = "application.yaml";

    private @Nullable String indexPath;
    private long commitIntervalMs = 5000;
    private @Nullable String settingsPath;
    private int batchSize = 500;
    private int threadPoolSize = 2;
    private long progressLogIntervalMs = 30000;

    private ApplicationConfig() {
    }

    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        try (final InputStream bundled = ApplicationConfig.class.getClassLoader()
                .getResourceAsStream(BUNDLED_CONFIG_FILE)) {
            if (bundled != null) {
                config.applyYamlSource(bundled, "classpath:" + BUNDLED_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Could not read bundled {}", BUNDLED_CONFIG_FILE, e);
        }

        final Path userConfig = getUserConfigPath();
        if (Files.isRegularFile(userConfig)) {
            try (final InputStream in = Files.newInputStream(userConfig)) {
                config.applyYamlSource(in, userConfig.toString());
            } catch (final IOException e) {
                logger.warn("Could not read {}", userConfig, e);
            }
        }

        config.applyOverrides();

        logger.info("Configuration loaded: indexPath={}, settingsPath={}, batchSize={}, threadPoolSize={}",
                config.indexPath, config.settingsPath, config.batchSize, config.threadPoolSize);
        return config;
    }

    /**
     * Configuration with built-in defaults, rooted at the given directory. Neither files nor
     * the environment are consulted.
     */
    public static ApplicationConfig forDirectory(final Path baseDirectory) {
        final ApplicationConfig config = new ApplicationConfig();
        config.indexPath = baseDirectory.resolve("index").toString();
        config.settingsPath = baseDirectory.resolve("settings.yaml").toString();
        return config;
    }

    private void applyYamlSource(final InputStream in, final String description) {
        final Object document = new Yaml().load(in);
        if (document instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            final Map<String, Object> typed = (Map<String, Object>) map;
            applyYamlConfig(typed);
            logger.debug("Applied configuration from {}", description);
        } else if (document != null) {
            logger.warn("Ignoring {}: top level is not a mapping", description);
        }
    }

    void applyYamlConfig(final Map<String, Object> document) {
        final Map<?, ?> root = section(document, ROOT_KEY);

        final Map<?, ?> index = section(root, "index");
        indexPath = stringValue(index, "path", indexPath);
        commitIntervalMs = longValue(index, "commit-interval-ms", commitIntervalMs);

        settingsPath = stringValue(section(root, "settings"), "path", settingsPath);

        final Map<?, ?> sync = section(root, "sync");
        batchSize = (int) longValue(sync, "batch-size", batchSize);
        threadPoolSize = (int) longValue(sync, "thread-pool-size", threadPoolSize);
        progressLogIntervalMs = longValue(sync, "progress-log-interval-ms", progressLogIntervalMs);
    }

    private void applyOverrides() {
        final String envIndexPath = nonBlank(System.getenv(ENV_INDEX_PATH));
        if (envIndexPath != null) {
            indexPath = envIndexPath;
            logger.info("Index path from environment: {}", indexPath);
        } else {
            final String propIndexPath = nonBlank(System.getProperty(PROP_INDEX_PATH));
            if (propIndexPath != null) {
                indexPath = propIndexPath;
            }
        }

        final String envSettingsPath = nonBlank(System.getenv(ENV_SETTINGS_PATH));
        if (envSettingsPath != null) {
            settingsPath = envSettingsPath;
            logger.info("Settings path from environment: {}", settingsPath);
        }

        if (nonBlank(indexPath) == null) {
            indexPath = getConfigDirectory().resolve("index").toString();
        }
        if (nonBlank(settingsPath) == null) {
            settingsPath = getConfigDirectory().resolve("settings.yaml").toString();
        }
    }

    /**
     * Replaces every {@code ${NAME}} or {@code ${NAME:default}} placeholder. Unknown names
     * without default become the empty string.
     */
    static @Nullable String resolveVariables(final @Nullable String value) {
        if (value == null) {
            return null;
        }
        final StringBuilder resolved = new StringBuilder();
        int position = 0;
        while (position < value.length()) {
            final int open = value.indexOf("${", position);
            final int close = open < 0 ? -1 : value.indexOf('}', open);
            if (close < 0) {
                resolved.append(value, position, value.length());
                break;
            }
            resolved.append(value, position, open);

            final String expression = value.substring(open + 2, close);
            final int colon = expression.indexOf(':');
            final String name = colon < 0 ? expression : expression.substring(0, colon);
            final String fallback = colon < 0 ? "" : expression.substring(colon + 1);

            String replacement = nonBlank(System.getenv(name));
            if (replacement == null) {
                replacement = System.getProperty(name, fallback);
            }
            resolved.append(resolveVariables(replacement));
            position = close + 1;
        }
        return resolved.toString();
    }

    private static Map<?, ?> section(final @Nullable Map<?, ?> parent, final String key) {
        if (parent == null) {
            return Map.of();
        }
        final Object value = parent.get(key);
        return value instanceof Map<?, ?> map ? map : Map.of();
    }

    private static @Nullable String stringValue(final Map<?, ?> section, final String key,
                                                final @Nullable String current) {
        final Object value = section.get(key);
        return value != null ? resolveVariables(value.toString()) : current;
    }

    private static long longValue(final Map<?, ?> section, final String key, final long current) {
        final Object value = section.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(resolveVariables(value.toString()).trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring non-numeric value for {}: {}", key, value);
            }
        }
        return current;
    }

    private static @Nullable String nonBlank(final @Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    private static Path getConfigDirectory() {
        return Path.of(System.getProperty("user.home"), CONFIG_DIR);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public long getCommitIntervalMs() {
        return commitIntervalMs;
    }

    public String getSettingsPath() {
        return settingsPath;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public long getProgressLogIntervalMs() {
        return progressLogIntervalMs;
    }
}
