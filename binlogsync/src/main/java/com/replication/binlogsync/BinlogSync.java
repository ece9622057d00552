package com.replication.binlogsync;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;
import com.replication.binlogsync.commons.checkpoint.PositionStorage;
import com.replication.binlogsync.commons.conf.Flavor;
import com.replication.binlogsync.commons.conf.MySQLDsn;
import com.replication.binlogsync.commons.metrics.Metrics;
import com.replication.binlogsync.schema.AlterTableStatement;
import com.replication.binlogsync.schema.FullTableName;
import com.replication.binlogsync.schema.InformationSchemaLoader;
import com.replication.binlogsync.schema.JdbcServerStatusReader;
import com.replication.binlogsync.schema.ServerStatusReader;
import com.replication.binlogsync.schema.TableSchema;
import com.replication.binlogsync.schema.TableSchemaCache;
import com.replication.binlogsync.schema.TableSchemaLoader;
import com.replication.binlogsync.supplier.BinlogConnection;
import com.replication.binlogsync.supplier.BinlogConnectionConfiguration;
import com.replication.binlogsync.supplier.BinlogConnectionFactory;
import com.replication.binlogsync.supplier.ConnectionClosedException;
import com.replication.binlogsync.supplier.model.BinlogEvent;
import com.replication.binlogsync.supplier.model.QueryEventData;
import com.replication.binlogsync.supplier.model.RotateEventData;
import com.replication.binlogsync.supplier.model.RowsEventData;
import com.replication.binlogsync.supplier.model.TableMapEventData;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;

import org.apache.commons.dbcp2.BasicDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Replication client for one MySQL schema.
 * <p>
 * Registers as a replication slave, follows the binary log from the configured
 * position and hands row changes of the DSN's schema to the registered
 * {@link RowsEventHandler}s. Events are processed by a single worker thread in
 * stream order; the position of the last fully processed event is tracked and
 * persisted through a {@link PositionStorage}.
 * <p>
 * Usage:
 * <pre>
 * BinlogSync sync = BinlogSync.builder("user:pass@tcp(db:3306)/shop?BinlogSlaveId=101")
 *         .positionStorage(storage)
 *         .build();
 * sync.registerRowsEventHandler(handler);
 * sync.start();
 * ...
 * sync.close();
 * </pre>
 */
public class BinlogSync implements Closeable {
    private static final Logger LOG = LogManager.getLogger(BinlogSync.class);

    public interface Parameters {
        String BINLOG_START_FILE = "BinlogStartFile";
        String BINLOG_START_POSITION = "BinlogStartPosition";
        String BINLOG_SLAVE_ID = "BinlogSlaveId";
        String FLAVOR = "flavor";
    }

    static final List<String> CUSTOM_PARAMETERS = Collections.unmodifiableList(Arrays.asList(
            Parameters.BINLOG_START_FILE,
            Parameters.BINLOG_START_POSITION,
            Parameters.BINLOG_SLAVE_ID,
            Parameters.FLAVOR
    ));

    static final String BINLOG_FORMAT = "binlog_format";
    static final String BINLOG_ROW_IMAGE = "binlog_row_image";
    static final String ROW_FORMAT = "ROW";

    private static final String MYSQL_DRIVER_CLASS = "com.mysql.cj.jdbc.Driver";
    private static final long WORKER_JOIN_TIMEOUT_SECONDS = 5L;

    private final MySQLDsn dsn;
    private final Map<String, String> customParameters;
    private final Flavor flavor;
    private final long serverId;

    private final AtomicReference<State> state;
    private final AtomicBoolean notified;
    private final Metrics metrics;
    private final Meter eventsReceived;
    private final Counter eventsDropped;
    private final Counter rowsDispatched;

    private final RowsEventHandlerRegistry registry;

    private BasicDataSource ownedDataSource;
    private ServerStatusReader statusReader;
    private TableSchemaCache tableSchemaCache;
    private MasterPositionTracker tracker;
    private BinlogConnection connection;

    private ExecutorService executor;
    private volatile Thread worker;
    private volatile Consumer<Exception> exceptionHandler;

    // set between BEGIN and its XID or COMMIT, the position is not moved inside it
    private boolean inTransaction;

    private BinlogSync(Builder builder) throws BinlogSyncException {
        this.state = new AtomicReference<>(State.CREATED);
        this.notified = new AtomicBoolean(false);
        this.registry = new RowsEventHandlerRegistry();
        this.metrics = (builder.metrics != null) ? (builder.metrics) : (Metrics.none());
        this.eventsReceived = this.metrics.meter("events.received");
        this.eventsDropped = this.metrics.counter("events.dropped");
        this.rowsDispatched = this.metrics.counter("rows.dispatched");

        try {
            this.dsn = MySQLDsn.parse(builder.dsn);
        } catch (IllegalArgumentException exception) {
            this.release(false);
            throw new BinlogSyncException(String.format("invalid DSN: %s", exception.getMessage()), exception);
        }

        if (this.dsn.getSchema() == null || this.dsn.getSchema().isEmpty()) {
            this.release(false);
            throw new BinlogSyncException(String.format("DSN names no schema to replicate: %s", this.dsn));
        }

        // the connector rejects parameters it does not know
        this.customParameters = new HashMap<>();

        for (String name : BinlogSync.CUSTOM_PARAMETERS) {
            String value = this.dsn.removeParameter(name);

            if (value != null && !value.isEmpty()) {
                this.customParameters.put(name, value);
            }
        }

        this.flavor = Flavor.of(this.customParameters.get(Parameters.FLAVOR));

        try {
            this.serverId = BinlogSync.parseLong(
                    this.customParameters.get(Parameters.BINLOG_SLAVE_ID),
                    BinlogConnectionConfiguration.DEFAULT_SERVER_ID
            );

            this.connect(builder);
        } catch (BinlogSyncException exception) {
            this.release(false);
            throw exception;
        } catch (SQLException | IOException | RuntimeException exception) {
            this.release(false);
            throw new BinlogSyncException(String.format("error setting up binlog sync for %s: %s", this.dsn, exception.getMessage()), exception);
        }

        this.metrics.gauge("position.offset", (Gauge<Long>) () -> this.tracker.getPosition().getPosition());

        this.state.set(State.CONNECTED);

        BinlogSync.LOG.info("binlog sync connected to {} as slave {} at {}", this.dsn, this.serverId, this.tracker.getPosition());
    }

    private void connect(Builder builder) throws BinlogSyncException, SQLException, IOException {
        DataSource dataSource = builder.dataSource;

        if (dataSource == null) {
            this.ownedDataSource = this.getDataSource();
            dataSource = this.ownedDataSource;
        }

        this.statusReader = (builder.statusReader != null) ? (builder.statusReader) : (new JdbcServerStatusReader(dataSource));
        this.statusReader.ping();

        TableSchemaLoader loader = (builder.tableSchemaLoader != null)
                ? (builder.tableSchemaLoader)
                : (new InformationSchemaLoader(dataSource, this.dsn.getSchema()));
        Counter tablesLoaded = this.metrics.counter("tables.loaded");

        this.tableSchemaCache = new TableSchemaCache(tableName -> {
            TableSchema tableSchema = loader.load(tableName);
            tablesLoaded.inc();
            return tableSchema;
        });

        MasterStatus start = this.getStartPosition(builder);

        this.tracker = new MasterPositionTracker(start, builder.positionStorage, builder.positionPath, builder.clock, this.metrics);

        this.checkBinlogFormat();

        BinlogConnectionConfiguration configuration = BinlogConnectionConfiguration.builder()
                .serverId(this.serverId)
                .flavor(this.flavor)
                .host(this.dsn.getHost())
                .port(this.dsn.getPort())
                .user(this.dsn.getUser())
                .password(this.dsn.getPassword())
                .connectTimeout(builder.connectTimeout)
                .queueSize(builder.queueSize)
                .build();

        this.connection = builder.connectionFactory.create(configuration);
        this.connection.open(start);
    }

    private BasicDataSource getDataSource() {
        BasicDataSource dataSource = new BasicDataSource();

        dataSource.setDriverClassName(BinlogSync.MYSQL_DRIVER_CLASS);
        dataSource.setUrl(this.dsn.toJdbcUrl());
        dataSource.setUsername(this.dsn.getUser());
        dataSource.setPassword(this.dsn.getPassword());

        return dataSource;
    }

    private MasterStatus getStartPosition(Builder builder) throws SQLException, IOException {
        MasterStatus start = this.statusReader.readMasterStatus();

        if (builder.resumeFromStorage) {
            MasterStatus stored = MasterPositionTracker.load(builder.positionStorage, builder.positionPath);

            if (stored != null) {
                BinlogSync.LOG.info("resuming from stored position {}", stored);
                start = stored;
            } else {
                BinlogSync.LOG.info("no stored position at {}, starting from master status {}", builder.positionPath, start);
            }
        }

        String startFile = this.customParameters.get(Parameters.BINLOG_START_FILE);

        if (startFile != null) {
            start = start.withFile(startFile);
        }

        long startPosition = BinlogSync.parseLong(this.customParameters.get(Parameters.BINLOG_START_POSITION), 0L);

        if (startPosition >= MasterStatus.MIN_POSITION) {
            start = start.withPosition(startPosition);
        }

        return start;
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }

        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(String.format("not a number: \"%s\"", value), exception);
        }
    }

    private void checkBinlogFormat() throws SQLException, NotSupportedException {
        String format = this.statusReader.readVariable(BinlogSync.BINLOG_FORMAT);

        if (!BinlogSync.ROW_FORMAT.equalsIgnoreCase(format)) {
            throw new NotSupportedException(BinlogSync.BINLOG_FORMAT, format, BinlogSync.ROW_FORMAT);
        }
    }

    /**
     * Fails if the server writes row images other than {@code image} (FULL, MINIMAL or NOBLOB).
     * Only MySQL reports the setting; servers before 5.6 report nothing and pass.
     */
    public void checkBinlogRowImage(String image) throws BinlogSyncException {
        if (this.flavor != Flavor.MYSQL) {
            return;
        }

        try {
            String value = this.statusReader.readVariable(BinlogSync.BINLOG_ROW_IMAGE);

            if (value != null && !value.isEmpty() && !value.equalsIgnoreCase(image)) {
                throw new NotSupportedException(BinlogSync.BINLOG_ROW_IMAGE, value, image);
            }
        } catch (SQLException exception) {
            throw new BinlogSyncException(String.format("error reading %s", BinlogSync.BINLOG_ROW_IMAGE), exception);
        }
    }

    public void registerRowsEventHandler(RowsEventHandler handler) {
        this.registry.register(handler);
    }

    /**
     * Called once if the worker stops for any reason other than {@link #close()}.
     */
    public void onException(Consumer<Exception> handler) {
        this.exceptionHandler = handler;
    }

    /**
     * Starts the worker consuming the replication stream.
     *
     * @throws IllegalStateException if not {@link State#CONNECTED}
     */
    public void start() {
        if (!this.state.compareAndSet(State.CONNECTED, State.STREAMING)) {
            throw new IllegalStateException(String.format("cannot start binlog sync in state %s", this.state.get()));
        }

        BinlogSync.LOG.info("starting binlog sync worker with {} handlers", this.registry.size());

        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "binlogsync-worker");
            thread.setDaemon(true);
            return thread;
        });
        this.executor.submit(this::run);
    }

    private void run() {
        this.worker = Thread.currentThread();

        try {
            while (this.state.get() == State.STREAMING) {
                BinlogEvent event = this.connection.receive();

                this.eventsReceived.mark();
                this.handle(event);
            }
        } catch (ConnectionClosedException exception) {
            if (!this.state.get().isClosing()) {
                BinlogSync.LOG.warn("binlog connection closed unexpectedly");
                this.fail(exception);
            }
        } catch (IOException exception) {
            if (this.state.get().isClosing()) {
                BinlogSync.LOG.debug("binlog stream ended while closing: {}", exception.getMessage());
            } else {
                BinlogSync.LOG.error("binlog sync terminated unexpectedly", exception);
                this.fail(exception);
            }
        } catch (RowsEventHandlerException | RuntimeException exception) {
            BinlogSync.LOG.error("binlog sync stopped at {}", this.tracker.getPosition(), exception);
            this.fail(exception);
        }

        BinlogSync.LOG.info("binlog sync worker stopped at {}", this.tracker.getPosition());
    }

    private void fail(Exception exception) {
        if (this.notified.getAndSet(true)) {
            return;
        }

        Consumer<Exception> handler = this.exceptionHandler;

        if (handler != null) {
            try {
                handler.accept(exception);
            } catch (RuntimeException handlerException) {
                BinlogSync.LOG.error("exception handler failed", handlerException);
            }
        }

        CompletableFuture.runAsync(() -> {
            try {
                this.close();
            } catch (IOException closeException) {
                BinlogSync.LOG.error("error closing binlog sync after failure", closeException);
            }
        });
    }

    void handle(BinlogEvent event) throws RowsEventHandlerException {
        if (BinlogSync.LOG.isDebugEnabled()) {
            BinlogSync.LOG.debug("received {}", event);
        }

        switch (event.getEventType()) {
            case ROTATE: {
                RotateEventData data = event.getData();

                if (data != null) {
                    this.tracker.save(data.getBinlogFilename(), data.getBinlogPosition());
                }
                return;
            }
            case HEARTBEAT:
                return;
            case TABLE_MAP: {
                TableMapEventData data = event.getData();

                this.tableSchemaCache.registerTableMap(data.getTableId(), new FullTableName(data.getDatabase(), data.getTable()));
                this.inTransaction = true;
                break;
            }
            case WRITE_ROWS:
            case UPDATE_ROWS:
            case DELETE_ROWS:
                this.inTransaction = true;
                this.handleRows(RowsAction.of(event.getEventType()), event.getData());
                break;
            case QUERY:
                this.handleQuery(event.getData());
                break;
            case XID:
                this.registry.complete();
                this.inTransaction = false;
                break;
            default:
                break;
        }

        long nextPosition = event.getHeader().getNextPosition();

        if (nextPosition > 0L && !this.inTransaction) {
            this.tracker.save(this.tracker.getPosition().getFile(), nextPosition);
        }
    }

    private void handleRows(RowsAction action, RowsEventData data) throws RowsEventHandlerException {
        FullTableName tableName = this.tableSchemaCache.getTableName(data.getTableId());

        if (tableName == null) {
            BinlogSync.LOG.warn("dropping {} event for unknown table id {}", action, data.getTableId());
            this.eventsDropped.inc();
            return;
        }

        if (!this.dsn.getSchema().equalsIgnoreCase(tableName.getDatabase())) {
            if (BinlogSync.LOG.isDebugEnabled()) {
                BinlogSync.LOG.debug("skipping {} event of {}", action, tableName);
            }
            return;
        }

        TableSchema tableSchema;

        try {
            tableSchema = this.findTable(tableName.getName());
        } catch (SQLException exception) {
            BinlogSync.LOG.warn("dropping {} event of {}: {}", action, tableName, exception.getMessage());
            this.eventsDropped.inc();
            return;
        }

        this.registry.dispatch(action, tableSchema, data.getRows());
        this.rowsDispatched.inc(data.getRows().size());
    }

    private void handleQuery(QueryEventData data) throws RowsEventHandlerException {
        String sql = data.getSql().trim();

        if ("BEGIN".equalsIgnoreCase(sql)) {
            this.inTransaction = true;
            return;
        }

        if ("COMMIT".equalsIgnoreCase(sql)) {
            this.registry.complete();
            this.inTransaction = false;
            return;
        }

        // any other statement is committed on its own
        this.inTransaction = false;

        AlterTableStatement.parse(sql).ifPresent(tableName -> {
            String database = (tableName.getDatabase() != null) ? (tableName.getDatabase()) : (data.getDatabase());

            if (database == null || database.isEmpty() || this.dsn.getSchema().equalsIgnoreCase(database)) {
                BinlogSync.LOG.info("table {} altered, clearing its cached structure", tableName.getName());
                this.tableSchemaCache.invalidate(tableName.getName());
            }
        });
    }

    /**
     * Structure of a table of the DSN's schema, loaded on first use.
     */
    public TableSchema findTable(String tableName) throws SQLException {
        return this.tableSchemaCache.find(tableName);
    }

    public void clearTableCache(String tableName) {
        this.tableSchemaCache.invalidate(tableName);
    }

    public void clearTableCache() {
        this.tableSchemaCache.invalidateAll();
    }

    /**
     * Position of the last fully processed event.
     */
    public MasterStatus syncedPosition() {
        return this.tracker.getPosition();
    }

    public State getState() {
        return this.state.get();
    }

    public String getSchema() {
        return this.dsn.getSchema();
    }

    public Flavor getFlavor() {
        return this.flavor;
    }

    public long getServerId() {
        return this.serverId;
    }

    Map<String, String> getConnectorParameters() {
        return this.dsn.getParameters();
    }

    /**
     * Stops streaming, waits for the worker, persists the position and releases
     * connections. Only the first call does the work; later calls return at once.
     */
    @Override
    public void close() throws IOException {
        while (true) {
            State current = this.state.get();

            if (current.isClosing()) {
                return;
            }

            if (this.state.compareAndSet(current, State.CLOSING)) {
                break;
            }
        }

        BinlogSync.LOG.info("closing binlog sync");

        IOException failure = this.release(true);

        this.state.set(State.CLOSED);

        BinlogSync.LOG.info("binlog sync closed at {}", (this.tracker != null) ? (this.tracker.getPosition()) : (null));

        if (failure != null) {
            throw failure;
        }
    }

    private IOException release(boolean flush) {
        IOException failure = null;

        if (this.connection != null) {
            try {
                this.connection.close();
            } catch (IOException exception) {
                failure = exception;
            }
        }

        this.joinWorker();

        if (flush && this.tracker != null) {
            this.tracker.flush();
        }

        if (this.ownedDataSource != null) {
            try {
                this.ownedDataSource.close();
            } catch (SQLException exception) {
                failure = BinlogSync.first(failure, new IOException("error closing database connection pool", exception));
            }
        }

        try {
            this.metrics.close();
        } catch (IOException exception) {
            failure = BinlogSync.first(failure, exception);
        }

        return failure;
    }

    private static IOException first(IOException failure, IOException exception) {
        if (failure == null) {
            return exception;
        }

        failure.addSuppressed(exception);
        return failure;
    }

    private void joinWorker() {
        if (this.executor == null) {
            return;
        }

        this.executor.shutdown();

        if (Thread.currentThread() == this.worker) {
            return;
        }

        try {
            if (!this.executor.awaitTermination(BinlogSync.WORKER_JOIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                BinlogSync.LOG.warn("binlog sync worker did not stop in time");
                this.executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            BinlogSync.LOG.warn("interrupted while waiting for the binlog sync worker");
            this.executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder(String dsn) {
        return new Builder(dsn);
    }

    public static class Builder {
        private final String dsn;
        private DataSource dataSource;
        private PositionStorage positionStorage;
        private String positionPath = PositionStorage.DEFAULT_PATH;
        private boolean resumeFromStorage;
        private BinlogConnectionFactory connectionFactory = BinlogConnectionFactory.DEFAULT;
        private ServerStatusReader statusReader;
        private TableSchemaLoader tableSchemaLoader;
        private Metrics metrics;
        private LongSupplier clock = System::currentTimeMillis;
        private long connectTimeout = BinlogConnectionConfiguration.DEFAULT_CONNECT_TIMEOUT;
        private int queueSize = BinlogConnectionConfiguration.DEFAULT_QUEUE_SIZE;

        private Builder(String dsn) {
            this.dsn = Objects.requireNonNull(dsn, "dsn");
        }

        /**
         * Connection pool used for metadata and status queries. It is not closed by the client.
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Where the position is persisted; without one it is only kept in memory.
         */
        public Builder positionStorage(PositionStorage positionStorage) {
            this.positionStorage = positionStorage;
            return this;
        }

        public Builder positionPath(String positionPath) {
            this.positionPath = Objects.requireNonNull(positionPath);
            return this;
        }

        public Builder resumeFromStorage(boolean resumeFromStorage) {
            this.resumeFromStorage = resumeFromStorage;
            return this;
        }

        public Builder connectionFactory(BinlogConnectionFactory connectionFactory) {
            this.connectionFactory = Objects.requireNonNull(connectionFactory);
            return this;
        }

        public Builder statusReader(ServerStatusReader statusReader) {
            this.statusReader = statusReader;
            return this;
        }

        public Builder tableSchemaLoader(TableSchemaLoader tableSchemaLoader) {
            this.tableSchemaLoader = tableSchemaLoader;
            return this;
        }

        /**
         * Metrics owned by the client from now on; closed with it.
         */
        public Builder metrics(Metrics metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder connectTimeout(long connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        /**
         * Connects to the server and opens the replication stream at the start position.
         *
         * @throws BinlogSyncException if any step failed; everything opened so far is released
         */
        public BinlogSync build() throws BinlogSyncException {
            return new BinlogSync(this);
        }
    }
}
