package com.replication.binlogsync.schema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Table metadata of the replicated schema, loaded lazily and at most once per
 * table at a time.
 * <p>
 * Invalidation wins over loads that were running while it happened: such a
 * load still answers its callers but its result is not kept.
 */
public class TableSchemaCache {
    private static final Logger LOG = LogManager.getLogger(TableSchemaCache.class);

    private final TableSchemaLoader loader;
    private final SingleFlight<String, TableSchema> singleFlight;
    private final Map<Long, FullTableName> tableIdToTableNameMap;

    private final ReadWriteLock lock;
    private final Map<String, TableSchema> tableSchemaMap;
    private long generation;

    public TableSchemaCache(TableSchemaLoader loader) {
        this.loader = Objects.requireNonNull(loader);
        this.singleFlight = new SingleFlight<>();
        this.tableIdToTableNameMap = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.tableSchemaMap = new HashMap<>();
        this.generation = 0L;
    }

    /**
     * Returns the cached table or loads it through the {@link TableSchemaLoader}.
     *
     * @throws SQLException if loading failed; the failure is not cached
     */
    public TableSchema find(String tableName) throws SQLException {
        Objects.requireNonNull(tableName, "table name");

        Lock readLock = this.lock.readLock();
        readLock.lock();

        try {
            TableSchema tableSchema = this.tableSchemaMap.get(tableName);

            if (tableSchema != null) {
                return tableSchema;
            }
        } finally {
            readLock.unlock();
        }

        try {
            return this.singleFlight.execute(tableName, () -> this.load(tableName));
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();

            if (cause instanceof SQLException) {
                throw (SQLException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }

            throw new SQLException(String.format("error loading table %s", tableName), cause);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new SQLException(String.format("interrupted while loading table %s", tableName), exception);
        }
    }

    private TableSchema load(String tableName) throws SQLException {
        long generation = this.getGeneration();

        TableSchema tableSchema = this.loader.load(tableName);

        Lock writeLock = this.lock.writeLock();
        writeLock.lock();

        try {
            if (this.generation == generation) {
                this.tableSchemaMap.put(tableName, tableSchema);
            } else {
                TableSchemaCache.LOG.debug("table {} invalidated while loading, not caching it", tableName);
            }
        } finally {
            writeLock.unlock();
        }

        return tableSchema;
    }

    private long getGeneration() {
        Lock readLock = this.lock.readLock();
        readLock.lock();

        try {
            return this.generation;
        } finally {
            readLock.unlock();
        }
    }

    public void invalidate(String tableName) {
        Lock writeLock = this.lock.writeLock();
        writeLock.lock();

        try {
            this.generation++;
            this.tableSchemaMap.remove(tableName);
        } finally {
            writeLock.unlock();
        }

        TableSchemaCache.LOG.debug("invalidated table {}", tableName);
    }

    public void invalidateAll() {
        Lock writeLock = this.lock.writeLock();
        writeLock.lock();

        try {
            this.generation++;
            this.tableSchemaMap.clear();
        } finally {
            writeLock.unlock();
        }

        this.tableIdToTableNameMap.clear();

        TableSchemaCache.LOG.debug("invalidated all tables");
    }

    public int size() {
        Lock readLock = this.lock.readLock();
        readLock.lock();

        try {
            return this.tableSchemaMap.size();
        } finally {
            readLock.unlock();
        }
    }

    public List<String> getTableNames() {
        Lock readLock = this.lock.readLock();
        readLock.lock();

        try {
            List<String> tableNames = new ArrayList<>(this.tableSchemaMap.keySet());
            Collections.sort(tableNames);
            return tableNames;
        } finally {
            readLock.unlock();
        }
    }

    public void registerTableMap(long tableId, FullTableName tableName) {
        this.tableIdToTableNameMap.put(tableId, tableName);
    }

    /**
     * @return the name bound by the latest table map event for this id, {@code null} if none was seen
     */
    public FullTableName getTableName(long tableId) {
        return this.tableIdToTableNameMap.get(tableId);
    }
}
