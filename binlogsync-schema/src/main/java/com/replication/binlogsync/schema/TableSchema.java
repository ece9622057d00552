package com.replication.binlogsync.schema;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Snapshot of a table's structure as loaded from the server. Instances are
 * immutable and safe to share between threads.
 */
public class TableSchema implements Serializable {
    private final FullTableName fullTableName;
    private final List<ColumnSchema> columnSchemas;
    private final boolean view;
    private final String create;

    public TableSchema(FullTableName fullTableName, List<ColumnSchema> columnSchemas, boolean view, String create) {
        this.fullTableName = Objects.requireNonNull(fullTableName);
        this.columnSchemas = Collections.unmodifiableList(new ArrayList<>(columnSchemas));
        this.view = view;
        this.create = create;
    }

    public FullTableName getFullTableName() {
        return this.fullTableName;
    }

    public List<ColumnSchema> getColumnSchemas() {
        return this.columnSchemas;
    }

    public boolean isView() {
        return this.view;
    }

    /**
     * @return the {@code SHOW CREATE TABLE} output, {@code null} if it could not be read
     */
    public String getCreate() {
        return this.create;
    }

    public List<String> getPrimaryKeyColumns() {
        return this.columnSchemas
                .stream()
                .filter(ColumnSchema::isPrimary)
                .map(ColumnSchema::getName)
                .collect(Collectors.toList());
    }

    public ColumnSchema getColumn(String name) {
        int index = this.indexOf(name);
        return (index >= 0) ? (this.columnSchemas.get(index)) : (null);
    }

    /**
     * Position of a column inside row images, {@code -1} if the table has no such column.
     */
    public int indexOf(String name) {
        for (int index = 0; index < this.columnSchemas.size(); index++) {
            if (this.columnSchemas.get(index).getName().equalsIgnoreCase(name)) {
                return index;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return String.format("%s %s", this.fullTableName, this.columnSchemas);
    }
}
