package de.mirkosertic.dbsearch.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores settings records in a single YAML file.
 * <p>
 * Layout: one top-level mapping per record key, holding the record's fields.
 * Every read and read-modify-write holds an exclusive lock on the sidecar file
 * {@code <name>.lock}, so instances in other processes and in this JVM never interleave.
 * The file is rewritten through a temporary sibling and an atomic move so that readers
 * never observe a half-written file.
 */
public class YamlSettingsPersistence implements SettingsPersistence {

    private static final Logger logger = LoggerFactory.getLogger(YamlSettingsPersistence.class);

    // File locks are held per JVM, so instances in one JVM also queue on a shared in-process lock
    private static final Map<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path settingsFile;
    private final Path lockFile;
    private final ReentrantLock localLock;
    private final Yaml yaml;

    public YamlSettingsPersistence(final Path settingsFile) {
        this.settingsFile = settingsFile.toAbsolutePath().normalize();
        this.lockFile = this.settingsFile.resolveSibling(this.settingsFile.getFileName() + ".lock");
        this.localLock = LOCAL_LOCKS.computeIfAbsent(this.settingsFile, k -> new ReentrantLock());
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    @Override
    public Map<String, Object> get(final String key) throws IOException {
        return locked(() -> {
            final Map<String, Object> record = readAll().get(key);
            return record != null ? new LinkedHashMap<>(record) : new LinkedHashMap<>();
        });
    }

    @Override
    public void set(final String key, final Map<String, Object> fields) throws IOException {
        locked(() -> {
            final Map<String, Map<String, Object>> all = readAll();
            all.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(fields);
            writeAll(all);
            return null;
        });
        logger.debug("Stored fields {} of {}", fields.keySet(), key);
    }

    @Override
    public long incrementField(final String key, final String field, final long delta) throws IOException {
        return locked(() -> {
            final Map<String, Map<String, Object>> all = readAll();
            final Map<String, Object> record = all.computeIfAbsent(key, k -> new LinkedHashMap<>());
            final long updated = toLong(record.get(field)) + delta;
            record.put(field, updated);
            writeAll(all);
            return updated;
        });
    }

    private <T> T locked(final LockedOperation<T> operation) throws IOException {
        localLock.lock();
        try {
            createParentDirectories();
            try (final FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 final FileLock ignored = channel.lock()) {
                return operation.run();
            }
        } finally {
            localLock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Map<String, Object>> readAll() throws IOException {
        final Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        if (!Files.exists(settingsFile)) {
            return result;
        }

        try (final Reader reader = Files.newBufferedReader(settingsFile)) {
            final Object loaded = yaml.load(reader);
            if (loaded == null) {
                return result;
            }
            if (!(loaded instanceof Map)) {
                throw new IOException("Settings file " + settingsFile + " does not contain a mapping");
            }
            for (final Map.Entry<String, Object> entry : ((Map<String, Object>) loaded).entrySet()) {
                if (entry.getValue() instanceof Map) {
                    result.put(entry.getKey(), new LinkedHashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warn("Ignoring non-mapping entry {} in {}", entry.getKey(), settingsFile);
                }
            }
            return result;
        } catch (final org.yaml.snakeyaml.error.YAMLException e) {
            throw new IOException("Failed to parse settings file " + settingsFile, e);
        }
    }

    private void writeAll(final Map<String, Map<String, Object>> all) throws IOException {
        final Path tempFile = Files.createTempFile(settingsFile.getParent(), settingsFile.getFileName().toString(), ".tmp");
        try {
            try (final Writer writer = Files.newBufferedWriter(tempFile)) {
                yaml.dump(all, writer);
            }
            Files.move(tempFile, settingsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private void createParentDirectories() throws IOException {
        final Path parent = settingsFile.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    private static long toLong(final Object value) throws IOException {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IOException("Field is not numeric: " + value, e);
        }
    }

    @FunctionalInterface
    private interface LockedOperation<T> {
        T run() throws IOException;
    }
}
