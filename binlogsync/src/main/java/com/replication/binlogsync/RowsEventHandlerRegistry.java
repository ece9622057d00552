package com.replication.binlogsync;

import com.replication.binlogsync.schema.TableSchema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers in registration order. Dispatch is synchronous and stops at the first failing handler.
 */
public class RowsEventHandlerRegistry {
    private static final Logger LOG = LogManager.getLogger(RowsEventHandlerRegistry.class);

    private final List<RowsEventHandler> handlers;

    public RowsEventHandlerRegistry() {
        this.handlers = new CopyOnWriteArrayList<>();
    }

    public void register(RowsEventHandler handler) {
        this.handlers.add(Objects.requireNonNull(handler));

        RowsEventHandlerRegistry.LOG.info("registered rows event handler {}", handler.name());
    }

    public List<RowsEventHandler> getHandlers() {
        return Collections.unmodifiableList(this.handlers);
    }

    public int size() {
        return this.handlers.size();
    }

    public void dispatch(RowsAction action, TableSchema table, List<Serializable[]> rows) throws RowsEventHandlerException {
        for (RowsEventHandler handler : this.handlers) {
            try {
                handler.onRows(action, table, rows);
            } catch (RowsEventHandlerException exception) {
                RowsEventHandlerRegistry.LOG.error("handler {} failed on {} of {}", handler.name(), action, table.getFullTableName(), exception);
                throw exception;
            } catch (RuntimeException exception) {
                throw new RowsEventHandlerException(String.format(
                        "handler %s failed on %s of %s", handler.name(), action, table.getFullTableName()
                ), exception);
            }
        }
    }

    public void complete() throws RowsEventHandlerException {
        for (RowsEventHandler handler : this.handlers) {
            try {
                handler.onComplete();
            } catch (RowsEventHandlerException exception) {
                RowsEventHandlerRegistry.LOG.error("handler {} failed to complete", handler.name(), exception);
                throw exception;
            } catch (RuntimeException exception) {
                throw new RowsEventHandlerException(String.format("handler %s failed to complete", handler.name()), exception);
            }
        }
    }
}
