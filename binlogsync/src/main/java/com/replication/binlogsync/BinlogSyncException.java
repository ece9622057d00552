package com.replication.binlogsync;

/**
 * The replication client could not be set up.
 */
public class BinlogSyncException extends Exception {
    public BinlogSyncException(String message) {
        super(message);
    }

    public BinlogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
