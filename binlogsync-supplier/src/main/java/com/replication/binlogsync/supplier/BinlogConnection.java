package com.replication.binlogsync.supplier;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;
import com.replication.binlogsync.supplier.model.BinlogEvent;

import java.io.Closeable;
import java.io.IOException;

/**
 * Replication connection registered as a slave of the master, delivering
 * decoded binlog events in stream order.
 */
public interface BinlogConnection extends Closeable {

    /**
     * Registers as a slave and starts streaming from the given coordinates.
     */
    void open(MasterStatus start) throws IOException;

    /**
     * Blocks until the next event is available.
     *
     * @throws ConnectionClosedException once {@link #close()} has been called
     * @throws IOException               if the stream broke
     */
    BinlogEvent receive() throws IOException;

    boolean isOpen();

    /**
     * Stops streaming and unblocks a pending {@link #receive()}. Calling it again has no effect.
     */
    @Override
    void close() throws IOException;
}
