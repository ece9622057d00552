package com.replication.binlogsync.supplier.model;

/**
 * Binds the numeric table id used by the following rows events to a table name.
 */
public class TableMapEventData implements EventData {
    private final long tableId;
    private final String database;
    private final String table;

    public TableMapEventData(long tableId, String database, String table) {
        this.tableId = tableId;
        this.database = database;
        this.table = table;
    }

    public long getTableId() {
        return this.tableId;
    }

    public String getDatabase() {
        return this.database;
    }

    public String getTable() {
        return this.table;
    }

    @Override
    public String toString() {
        return String.format("tableId: %d | database: %s | table: %s", this.tableId, this.database, this.table);
    }
}
