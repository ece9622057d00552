package com.replication.binlogsync;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;
import com.replication.binlogsync.commons.checkpoint.MasterStatusSerializer;
import com.replication.binlogsync.commons.checkpoint.PositionStorage;
import com.replication.binlogsync.commons.metrics.Metrics;

import com.codahale.metrics.Counter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Keeps the replication position in memory and persists it at most once per
 * {@link #SAVE_INTERVAL_MILLIS}.
 * <p>
 * A {@code null} storage means the position is only kept in memory.
 */
public class MasterPositionTracker {
    private static final Logger LOG = LogManager.getLogger(MasterPositionTracker.class);

    public static final long SAVE_INTERVAL_MILLIS = 1000L;

    private final PositionStorage storage;
    private final String path;
    private final LongSupplier clock;
    private final Counter persisted;

    private final ReadWriteLock lock;
    private final Object storageLock;
    private MasterStatus position;
    private long lastSaveTime;

    public MasterPositionTracker(MasterStatus initial, PositionStorage storage, String path, LongSupplier clock, Metrics metrics) {
        this.position = Objects.requireNonNull(initial);
        this.storage = storage;
        this.path = Objects.requireNonNull(path);
        this.clock = Objects.requireNonNull(clock);
        this.persisted = metrics.counter("position.persisted");
        this.lock = new ReentrantReadWriteLock();
        this.storageLock = new Object();
        this.lastSaveTime = Long.MIN_VALUE;
    }

    public MasterPositionTracker(MasterStatus initial, PositionStorage storage, String path) {
        this(initial, storage, path, System::currentTimeMillis, Metrics.none());
    }

    /**
     * Moves the position and persists it unless the last write is less than a second old.
     *
     * @return {@code false} if persisting failed; the in-memory position is updated regardless
     */
    public boolean save(String file, long position) {
        MasterStatus snapshot;
        long now = this.clock.getAsLong();

        Lock writeLock = this.lock.writeLock();
        writeLock.lock();

        try {
            this.position = this.position.withFile(file).withPosition(position);

            if (this.lastSaveTime != Long.MIN_VALUE && now - this.lastSaveTime < MasterPositionTracker.SAVE_INTERVAL_MILLIS) {
                return true;
            }

            snapshot = this.position;
        } finally {
            writeLock.unlock();
        }

        return this.persist(snapshot, now);
    }

    /**
     * Persists the current position now.
     */
    public boolean flush() {
        return this.persist(this.getPosition(), this.clock.getAsLong());
    }

    private boolean persist(MasterStatus status, long now) {
        if (this.storage == null) {
            if (MasterPositionTracker.LOG.isDebugEnabled()) {
                MasterPositionTracker.LOG.debug("no position storage configured, not persisting {}", status);
            }
            return true;
        }

        try {
            synchronized (this.storageLock) {
                this.storage.set(this.path, MasterStatusSerializer.serialize(status));
            }
        } catch (IOException exception) {
            MasterPositionTracker.LOG.error("failed to persist master position {} to {}", status, this.path, exception);
            return false;
        }

        this.persisted.inc();

        Lock writeLock = this.lock.writeLock();
        writeLock.lock();

        try {
            this.lastSaveTime = now;
        } finally {
            writeLock.unlock();
        }

        return true;
    }

    public MasterStatus getPosition() {
        Lock readLock = this.lock.readLock();
        readLock.lock();

        try {
            return this.position;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @return the persisted position, {@code null} if none was stored or there is no storage
     */
    public static MasterStatus load(PositionStorage storage, String path) throws IOException {
        if (storage == null) {
            return null;
        }

        return MasterStatusSerializer.deserialize(storage.get(path));
    }
}
