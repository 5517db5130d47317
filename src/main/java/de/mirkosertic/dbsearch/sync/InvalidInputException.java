package de.mirkosertic.dbsearch.sync;

/**
 * Rejected input: raised before any side effect takes place.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(final String message) {
        super(message);
    }

    public InvalidInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
