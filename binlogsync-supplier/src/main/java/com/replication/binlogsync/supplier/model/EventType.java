package com.replication.binlogsync.supplier.model;

/**
 * Event kinds the replication client distinguishes. Everything else the server
 * sends is reported as {@link #UNKNOWN}.
 */
public enum EventType {
    UNKNOWN,
    QUERY,
    ROTATE,
    FORMAT_DESCRIPTION,
    XID,
    TABLE_MAP,
    WRITE_ROWS,
    UPDATE_ROWS,
    DELETE_ROWS,
    HEARTBEAT,
    GTID;

    public boolean isRowMutation() {
        return this == WRITE_ROWS || this == UPDATE_ROWS || this == DELETE_ROWS;
    }
}
