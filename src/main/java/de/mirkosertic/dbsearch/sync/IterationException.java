package de.mirkosertic.dbsearch.sync;

import java.io.IOException;

/**
 * Reading a page of an ordered identifier set from the primary store failed.
 */
public class IterationException extends IOException {

    private final String orderedSetName;

    public IterationException(final String orderedSetName, final Throwable cause) {
        super("Failed to read ordered set " + orderedSetName, cause);
        this.orderedSetName = orderedSetName;
    }

    public String getOrderedSetName() {
        return orderedSetName;
    }
}
