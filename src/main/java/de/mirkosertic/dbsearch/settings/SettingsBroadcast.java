package de.mirkosertic.dbsearch.settings;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel between cooperating processes.
 */
public interface SettingsBroadcast {

    void publish(String channel, String payload) throws IOException;

    void subscribe(String channel, Consumer<String> handler);
}
