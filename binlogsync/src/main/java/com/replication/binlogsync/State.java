package com.replication.binlogsync;

/**
 * Lifecycle of a {@link BinlogSync}. States only move forward.
 */
public enum State {
    CREATED,
    CONNECTED,
    STREAMING,
    CLOSING,
    CLOSED;

    public boolean isClosing() {
        return this == CLOSING || this == CLOSED;
    }
}
