package com.replication.binlogsync.schema;

import java.sql.SQLException;

@FunctionalInterface
public interface TableSchemaLoader {
    TableSchema load(String tableName) throws SQLException;
}
