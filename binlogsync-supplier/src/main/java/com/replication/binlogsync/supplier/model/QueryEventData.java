package com.replication.binlogsync.supplier.model;

public class QueryEventData implements EventData {
    private final String database;
    private final String sql;

    public QueryEventData(String database, String sql) {
        this.database = database;
        this.sql = sql;
    }

    public String getDatabase() {
        return this.database;
    }

    public String getSql() {
        return this.sql;
    }

    @Override
    public String toString() {
        return String.format("database: %s | sql: %s", this.database, this.sql);
    }
}
