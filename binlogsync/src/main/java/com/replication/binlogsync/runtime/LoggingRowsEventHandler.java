package com.replication.binlogsync.runtime;

import com.replication.binlogsync.RowsAction;
import com.replication.binlogsync.RowsEventHandler;
import com.replication.binlogsync.schema.ColumnSchema;
import com.replication.binlogsync.schema.TableSchema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logs every row change, one line per row image.
 */
public class LoggingRowsEventHandler implements RowsEventHandler {
    private static final Logger LOG = LogManager.getLogger(LoggingRowsEventHandler.class);

    @Override
    public void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) {
        for (Serializable[] row : rows) {
            LoggingRowsEventHandler.LOG.info("{} {} {}", action, table.getFullTableName(), LoggingRowsEventHandler.toMap(table, row));
        }
    }

    @Override
    public void onComplete() {
        LoggingRowsEventHandler.LOG.info("commit");
    }

    static Map<String, Object> toMap(TableSchema table, Serializable[] row) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<ColumnSchema> columns = table.getColumnSchemas();

        for (int index = 0; index < row.length; index++) {
            String name = (index < columns.size()) ? (columns.get(index).getName()) : (String.format("@%d", index + 1));
            Serializable value = row[index];

            values.put(name, (value instanceof byte[]) ? (new String((byte[]) value, StandardCharsets.UTF_8)) : (value));
        }

        return values;
    }

    @Override
    public String name() {
        return "logging";
    }
}
