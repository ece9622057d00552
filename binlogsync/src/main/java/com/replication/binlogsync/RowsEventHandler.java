package com.replication.binlogsync;

import com.replication.binlogsync.schema.TableSchema;

import java.io.Serializable;
import java.util.List;

/**
 * Receives row changes of the replicated schema, in binlog order, on the
 * replication worker thread.
 */
public interface RowsEventHandler {

    /**
     * Called once per rows event.
     *
     * @param action the kind of change
     * @param table  structure of the changed table, columns in row image order
     * @param rows   row images; for {@link RowsAction#UPDATE} pairs of before and after images
     */
    void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) throws RowsEventHandlerException;

    /**
     * Called when a transaction committed.
     */
    void onComplete() throws RowsEventHandlerException;

    default String name() {
        return this.getClass().getName();
    }
}
