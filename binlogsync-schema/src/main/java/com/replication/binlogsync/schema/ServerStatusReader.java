package com.replication.binlogsync.schema;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;

import java.sql.SQLException;

/**
 * Queries the replication master about its state.
 */
public interface ServerStatusReader {
    void ping() throws SQLException;

    /**
     * Current binlog coordinates as reported by {@code SHOW MASTER STATUS}.
     */
    MasterStatus readMasterStatus() throws SQLException;

    /**
     * @return the value of a server variable, {@code null} if the server does not know it
     */
    String readVariable(String name) throws SQLException;
}
