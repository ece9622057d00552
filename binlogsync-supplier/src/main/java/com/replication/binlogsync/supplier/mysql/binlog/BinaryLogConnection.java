package com.replication.binlogsync.supplier.mysql.binlog;

import com.github.shyiko.mysql.binlog.BinaryLogClient;
import com.github.shyiko.mysql.binlog.event.Event;
import com.github.shyiko.mysql.binlog.event.deserialization.EventDeserializer;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;
import com.replication.binlogsync.supplier.BinlogConnection;
import com.replication.binlogsync.supplier.BinlogConnectionConfiguration;
import com.replication.binlogsync.supplier.ConnectionClosedException;
import com.replication.binlogsync.supplier.model.BinlogEvent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link BinlogConnection} backed by {@link BinaryLogClient}.
 * <p>
 * The client pushes events from its own listener thread; they are buffered in a
 * bounded queue and pulled by {@link #receive()}. A full queue blocks the listener
 * thread, which stops reading from the socket and so throttles the master.
 */
public class BinaryLogConnection implements BinlogConnection {
    private static final Logger LOG = LogManager.getLogger(BinaryLogConnection.class);

    private static final long POLL_TIMEOUT_MILLIS = 100L;

    private final BinlogConnectionConfiguration configuration;
    private final EventConverter converter;
    private final BlockingQueue<BinlogEvent> queue;
    private final AtomicBoolean opened;
    private final AtomicBoolean closed;
    private final AtomicReference<Exception> failure;

    private volatile BinaryLogClient client;

    public BinaryLogConnection(BinlogConnectionConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration);
        this.converter = new EventConverter();
        this.queue = new ArrayBlockingQueue<>(configuration.getQueueSize());
        this.opened = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
        this.failure = new AtomicReference<>();
    }

    private BinaryLogClient getClient() {
        BinaryLogClient client = new BinaryLogClient(
                this.configuration.getHost(),
                this.configuration.getPort(),
                this.configuration.getUser(),
                this.configuration.getPassword()
        );

        client.setServerId(this.configuration.getServerId());
        client.setHeartbeatInterval(this.configuration.getHeartbeatInterval());
        // a broken stream ends the session instead of silently reconnecting
        client.setKeepAlive(false);

        EventDeserializer eventDeserializer = new EventDeserializer();
        eventDeserializer.setCompatibilityMode(EventDeserializer.CompatibilityMode.CHAR_AND_BINARY_AS_BYTE_ARRAY);
        client.setEventDeserializer(eventDeserializer);

        client.registerLifecycleListener(this.getLifecycleListener(
                String.format("%s:%d", this.configuration.getHost(), this.configuration.getPort())
        ));

        client.registerEventListener(this::enqueue);

        return client;
    }

    BinaryLogClient.LifecycleListener getLifecycleListener(String address) {
        return new BinaryLogClient.LifecycleListener() {
            @Override
            public void onConnect(BinaryLogClient client) {
                BinaryLogConnection.LOG.info("binlog client connected to {}: {}/{}",
                        address, client.getBinlogFilename(), client.getBinlogPosition());
            }

            @Override
            public void onCommunicationFailure(BinaryLogClient client, Exception exception) {
                BinaryLogConnection.LOG.error("binlog client had communication failure with {}: {}", address, exception.getMessage());
                BinaryLogConnection.this.failure.compareAndSet(null, exception);
            }

            @Override
            public void onEventDeserializationFailure(BinaryLogClient client, Exception exception) {
                // the client skips the undecodable event, so the stream can no longer be trusted
                BinaryLogConnection.LOG.error("binlog client had event deserialization failure with {}", address, exception);
                BinaryLogConnection.this.failure.compareAndSet(null, exception);
            }

            @Override
            public void onDisconnect(BinaryLogClient client) {
                BinaryLogConnection.LOG.info("binlog client disconnected from {}", address);

                if (!BinaryLogConnection.this.closed.get()) {
                    BinaryLogConnection.this.failure.compareAndSet(
                            null,
                            new IOException(String.format("binlog client lost the connection to %s", address))
                    );
                }
            }
        };
    }

    void enqueue(Event event) {
        BinlogEvent binlogEvent = this.converter.convert(event);

        try {
            while (!this.closed.get()) {
                if (this.queue.offer(binlogEvent, BinaryLogConnection.POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
                BinaryLogConnection.LOG.debug("event queue full, waiting for the consumer");
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            BinaryLogConnection.LOG.warn("interrupted while queueing binlog event {}", binlogEvent.getHeader());
        }
    }

    @Override
    public void open(MasterStatus start) throws IOException {
        Objects.requireNonNull(start, "start position");

        if (this.closed.get()) {
            throw new ConnectionClosedException("binlog connection already closed");
        }

        if (this.opened.getAndSet(true)) {
            throw new IllegalStateException("binlog connection already opened");
        }

        this.client = this.getClient();
        this.client.setBinlogFilename(start.getFile());
        this.client.setBinlogPosition(start.getPosition());

        BinaryLogConnection.LOG.info("starting binlog client as slave {} ({}) from {}",
                this.configuration.getServerId(), this.configuration.getFlavor(), start);

        try {
            this.client.connect(this.configuration.getConnectTimeout());
        } catch (TimeoutException exception) {
            throw new IOException(String.format(
                    "binlog client could not connect to %s:%d within %d ms",
                    this.configuration.getHost(),
                    this.configuration.getPort(),
                    this.configuration.getConnectTimeout()
            ), exception);
        }
    }

    @Override
    public BinlogEvent receive() throws IOException {
        try {
            while (true) {
                if (this.closed.get()) {
                    throw new ConnectionClosedException("binlog connection closed");
                }

                Exception exception = this.failure.get();

                if (exception != null) {
                    throw (exception instanceof IOException) ? ((IOException) exception) : (new IOException(exception));
                }

                BinlogEvent event = this.queue.poll(BinaryLogConnection.POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);

                if (event != null) {
                    return event;
                }
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for binlog events");
        }
    }

    @Override
    public boolean isOpen() {
        return this.opened.get() && !this.closed.get() && this.failure.get() == null;
    }

    @Override
    public void close() throws IOException {
        if (this.closed.getAndSet(true)) {
            return;
        }

        BinaryLogConnection.LOG.info("stopping binlog client");

        try {
            BinaryLogClient client = this.client;

            if (client != null && client.isConnected()) {
                client.disconnect();
            }
        } finally {
            this.queue.clear();
        }
    }
}
