package org.depscope.source;

/**
 * The graph source as a whole could not be loaded (missing edge-list file, unreachable or
 * unparsable manifest). Unlike a failed lookup for a single package, this aborts the command.
 */
public class GraphSourceException extends Exception {

    public GraphSourceException(String message) {
        super(message);
    }

    public GraphSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
