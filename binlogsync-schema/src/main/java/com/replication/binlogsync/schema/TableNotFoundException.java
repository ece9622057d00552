package com.replication.binlogsync.schema;

import java.sql.SQLException;

public class TableNotFoundException extends SQLException {
    private final FullTableName tableName;

    public TableNotFoundException(FullTableName tableName) {
        super(String.format("table %s not found", tableName));
        this.tableName = tableName;
    }

    public FullTableName getTableName() {
        return this.tableName;
    }
}
