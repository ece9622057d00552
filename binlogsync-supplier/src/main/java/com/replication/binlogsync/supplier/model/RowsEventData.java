package com.replication.binlogsync.supplier.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Row images of a write, update or delete rows event.
 * <p>
 * Update events carry two images per changed row: {@code rows[2i]} is the row
 * before the change and {@code rows[2i + 1]} the row after it.
 */
public class RowsEventData implements EventData {
    private final long tableId;
    private final List<Serializable[]> rows;

    public RowsEventData(long tableId, List<Serializable[]> rows) {
        this.tableId = tableId;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static RowsEventData ofUpdates(long tableId, List<Map.Entry<Serializable[], Serializable[]>> updates) {
        List<Serializable[]> rows = new ArrayList<>(updates.size() * 2);

        for (Map.Entry<Serializable[], Serializable[]> update : updates) {
            rows.add(update.getKey());
            rows.add(update.getValue());
        }

        return new RowsEventData(tableId, rows);
    }

    public long getTableId() {
        return this.tableId;
    }

    public List<Serializable[]> getRows() {
        return this.rows;
    }

    @Override
    public String toString() {
        return String.format("tableId: %d | rows: %d", this.tableId, this.rows.size());
    }
}
