package de.mirkosertic.dbsearch;

import java.io.IOException;

/**
 * A write, removal or search against the index engine failed.
 */
public class IndexEngineException extends IOException {

    public IndexEngineException(final String message) {
        super(message);
    }

    public IndexEngineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
