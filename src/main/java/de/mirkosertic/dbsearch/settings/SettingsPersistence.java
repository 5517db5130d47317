package de.mirkosertic.dbsearch.settings;

import java.io.IOException;
import java.util.Map;

/**
 * Key/record storage shared by all cooperating processes.
 * <p>
 * A record is a flat map of field names to scalar values.
 */
public interface SettingsPersistence {

    /**
     * @return the stored record, or an empty map if the key does not exist
     */
    Map<String, Object> get(String key) throws IOException;

    /**
     * Merges the given fields into the stored record, creating it if needed.
     */
    void set(String key, Map<String, Object> fields) throws IOException;

    /**
     * Atomically adds {@code delta} to a numeric field. A missing field counts as {@code 0}.
     *
     * @return the new value
     */
    long incrementField(String key, String field, long delta) throws IOException;
}
