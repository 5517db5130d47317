package de.mirkosertic.dbsearch.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Broadcast channel for processes that share one JVM, e.g. several plugin instances
 * in one host or tests. Payloads are delivered synchronously to every subscriber,
 * including the publisher's own subscription.
 */
public class InProcessSettingsBroadcast implements SettingsBroadcast {

    private static final Logger logger = LoggerFactory.getLogger(InProcessSettingsBroadcast.class);

    private final Map<String, List<Consumer<String>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(final String channel, final String payload) {
        final List<Consumer<String>> handlers = subscribers.getOrDefault(channel, List.of());
        logger.debug("Publishing on {} to {} subscribers", channel, handlers.size());
        for (final Consumer<String> handler : handlers) {
            try {
                handler.accept(payload);
            } catch (final RuntimeException e) {
                // One failing subscriber must not keep the others from seeing the message
                logger.error("Subscriber on channel {} failed", channel, e);
            }
        }
    }

    @Override
    public void subscribe(final String channel, final Consumer<String> handler) {
        subscribers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(handler);
    }
}
