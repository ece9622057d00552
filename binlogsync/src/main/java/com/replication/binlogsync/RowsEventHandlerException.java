package com.replication.binlogsync;

/**
 * Thrown by a {@link RowsEventHandler} that could not process a change. Ends the replication session.
 */
public class RowsEventHandlerException extends Exception {
    public RowsEventHandlerException(String message) {
        super(message);
    }

    public RowsEventHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
