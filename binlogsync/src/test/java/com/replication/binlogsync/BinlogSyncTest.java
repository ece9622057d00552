package com.replication.binlogsync;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;
import com.replication.binlogsync.commons.checkpoint.MasterStatusSerializer;
import com.replication.binlogsync.commons.checkpoint.MemoryPositionStorage;
import com.replication.binlogsync.commons.checkpoint.PositionStorage;
import com.replication.binlogsync.commons.conf.Flavor;
import com.replication.binlogsync.schema.ColumnSchema;
import com.replication.binlogsync.schema.FullTableName;
import com.replication.binlogsync.schema.TableNotFoundException;
import com.replication.binlogsync.schema.TableSchema;
import com.replication.binlogsync.supplier.model.EventType;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BinlogSyncTest {
    private static final String DSN = "user:pass@tcp(db.local:3306)/shop";
    private static final MasterStatus MASTER_STATUS = new MasterStatus("bin.000001", 1234L);

    private FakeBinlogConnection connection;
    private FakeServerStatusReader statusReader;
    private AtomicInteger loads;
    private BinlogSync binlogSync;

    @Before
    public void before() {
        this.connection = new FakeBinlogConnection();
        this.statusReader = new FakeServerStatusReader(BinlogSyncTest.MASTER_STATUS);
        this.loads = new AtomicInteger();
    }

    @After
    public void after() throws IOException {
        if (this.binlogSync != null) {
            this.binlogSync.close();
        }
    }

    private static TableSchema table(String name) {
        return new TableSchema(
                new FullTableName("shop", name),
                Arrays.asList(
                        new ColumnSchema("id", "int", "int(11)", false, "PRI", ""),
                        new ColumnSchema("name", "varchar", "varchar(64)", true, "", "")
                ),
                false,
                null
        );
    }

    private BinlogSync.Builder builder(String dsn) {
        return BinlogSync.builder(dsn)
                .connectionFactory(this.connection::create)
                .statusReader(this.statusReader)
                .tableSchemaLoader(name -> {
                    this.loads.incrementAndGet();
                    if (name.equals("missing")) {
                        throw new TableNotFoundException(new FullTableName("shop", name));
                    }
                    return BinlogSyncTest.table(name);
                });
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;

        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5 seconds");
            }
            Thread.sleep(10L);
        }
    }

    @Test
    public void testCustomParametersAreStrippedFromDsn() throws BinlogSyncException {
        this.binlogSync = this.builder(
                "user:pass@tcp(host:3306)/shop?BinlogStartFile=bin.000005&BinlogStartPosition=4&BinlogSlaveId=101&charset=utf8mb4"
        ).build();

        assertEquals(State.CONNECTED, this.binlogSync.getState());
        assertEquals(101L, this.binlogSync.getServerId());
        assertEquals(101L, this.connection.getConfiguration().getServerId());
        assertEquals("host", this.connection.getConfiguration().getHost());
        assertEquals("user", this.connection.getConfiguration().getUser());
        assertEquals(new MasterStatus("bin.000005", 4L), this.binlogSync.syncedPosition());
        assertEquals(new MasterStatus("bin.000005", 4L), this.connection.getStart());
        assertEquals(Collections.singletonMap("charset", "utf8mb4"), this.binlogSync.getConnectorParameters());
        assertEquals("shop", this.binlogSync.getSchema());
        assertEquals(1, this.statusReader.getPings());
    }

    @Test
    public void testDefaults() throws BinlogSyncException {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();

        assertEquals(100L, this.binlogSync.getServerId());
        assertEquals(Flavor.MYSQL, this.binlogSync.getFlavor());
        assertEquals(BinlogSyncTest.MASTER_STATUS, this.binlogSync.syncedPosition());
    }

    @Test
    public void testStartPositionBelowMinimumIsIgnored() throws BinlogSyncException {
        this.binlogSync = this.builder(BinlogSyncTest.DSN + "?BinlogStartPosition=3&flavor=MariaDB").build();

        assertEquals(BinlogSyncTest.MASTER_STATUS, this.binlogSync.syncedPosition());
        assertEquals(Flavor.MARIADB, this.binlogSync.getFlavor());
    }

    @Test
    public void testInvalidDsn() {
        try {
            this.builder("user:pass@tcp(host:3306)").build();
            fail("expected BinlogSyncException");
        } catch (BinlogSyncException exception) {
            assertTrue(exception.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testDsnWithoutSchemaIsRejected() {
        for (String dsn : Arrays.asList("user:pass@tcp(host:3306)/", "user:pass@tcp(host:3306)/?serverId=7")) {
            try {
                this.builder(dsn).build();
                fail("expected BinlogSyncException for " + dsn);
            } catch (BinlogSyncException exception) {
                assertTrue(exception.getMessage().startsWith("DSN names no schema"));
            }
        }

        assertNull(this.connection.getConfiguration());
        assertEquals(0, this.statusReader.getPings());
    }

    @Test
    public void testRowFormatIsRequired() {
        this.statusReader.variable(BinlogSync.BINLOG_FORMAT, "STATEMENT");

        try {
            this.builder(BinlogSyncTest.DSN).build();
            fail("expected NotSupportedException");
        } catch (NotSupportedException exception) {
            assertEquals("binlog_format", exception.getVariable());
            assertEquals("STATEMENT", exception.getActual());
            assertEquals("ROW", exception.getExpected());
        } catch (BinlogSyncException exception) {
            fail("expected NotSupportedException");
        }

        assertNull(this.connection.getConfiguration());
    }

    @Test
    public void testResumeFromStorage() throws Exception {
        PositionStorage storage = new MemoryPositionStorage();
        storage.set(PositionStorage.DEFAULT_PATH, MasterStatusSerializer.serialize(new MasterStatus("bin.000003", 777L)));

        this.binlogSync = this.builder(BinlogSyncTest.DSN).positionStorage(storage).resumeFromStorage(true).build();

        assertEquals(new MasterStatus("bin.000003", 777L), this.connection.getStart());
    }

    @Test
    public void testStoredPositionIsIgnoredByDefault() throws Exception {
        PositionStorage storage = new MemoryPositionStorage();
        storage.set(PositionStorage.DEFAULT_PATH, MasterStatusSerializer.serialize(new MasterStatus("bin.000003", 777L)));

        this.binlogSync = this.builder(BinlogSyncTest.DSN).positionStorage(storage).build();

        assertEquals(BinlogSyncTest.MASTER_STATUS, this.connection.getStart());
    }

    @Test
    public void testStartTwice() throws BinlogSyncException {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.start();

        assertEquals(State.STREAMING, this.binlogSync.getState());

        try {
            this.binlogSync.start();
            fail("expected IllegalStateException");
        } catch (IllegalStateException exception) {
            assertEquals(State.STREAMING, this.binlogSync.getState());
        }
    }

    @Test
    public void testCheckBinlogRowImage() throws BinlogSyncException {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();

        this.binlogSync.checkBinlogRowImage("FULL");
        this.binlogSync.checkBinlogRowImage("full");

        try {
            this.binlogSync.checkBinlogRowImage("MINIMAL");
            fail("expected NotSupportedException");
        } catch (NotSupportedException exception) {
            assertEquals("FULL", exception.getActual());
        }

        this.statusReader.variable(BinlogSync.BINLOG_ROW_IMAGE, "");
        this.binlogSync.checkBinlogRowImage("MINIMAL");
    }

    @Test
    public void testRowImageIsNotCheckedOnMariaDB() throws BinlogSyncException {
        this.binlogSync = this.builder(BinlogSyncTest.DSN + "?flavor=mariadb").build();

        this.binlogSync.checkBinlogRowImage("MINIMAL");
    }

    @Test
    public void testPositionAdvancesAtTransactionBoundariesAndRotateResetsFile() throws Exception {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();

        this.binlogSync.handle(Events.rotate("bin.000002", 4L));

        assertEquals(new MasterStatus("bin.000002", 4L), this.binlogSync.syncedPosition());

        this.binlogSync.handle(Events.query("shop", "BEGIN", 120L));
        this.binlogSync.handle(Events.tableMap(1L, "shop", "customer", 160L));

        for (long nextPosition = 200L; nextPosition <= 1000L; nextPosition += 100L) {
            this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 1L, nextPosition, new Serializable[]{1, "a"}));

            assertEquals(new MasterStatus("bin.000002", 4L), this.binlogSync.syncedPosition());
        }

        this.binlogSync.handle(Events.xid(1L, 1100L));
        assertEquals(new MasterStatus("bin.000002", 1100L), this.binlogSync.syncedPosition());

        this.binlogSync.handle(Events.heartbeat());
        assertEquals(1100L, this.binlogSync.syncedPosition().getPosition());

        this.binlogSync.handle(Events.query("shop", "CREATE TABLE t2 (id INT)", 1300L));
        assertEquals(1300L, this.binlogSync.syncedPosition().getPosition());

        this.binlogSync.handle(Events.rotate("bin.000003", 4L));
        assertEquals(new MasterStatus("bin.000003", 4L), this.binlogSync.syncedPosition());
    }

    @Test
    public void testHandlersAreCalledInRegistrationOrder() throws Exception {
        List<String> log = Collections.synchronizedList(new ArrayList<>());

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();

        for (String name : Arrays.asList("H1", "H2", "H3")) {
            this.binlogSync.registerRowsEventHandler(new RecordingHandler(name, log));
        }

        this.binlogSync.start();
        this.connection.push(
                Events.tableMap(7L, "shop", "customer", 150L),
                Events.rows(EventType.WRITE_ROWS, 7L, 250L, new Serializable[]{1, "a"})
        );

        BinlogSyncTest.await(() -> log.size() >= 3);

        assertEquals(Arrays.asList("H1:insert", "H2:insert", "H3:insert"), log);
    }

    @Test
    public void testUpdateRowsArePassedAsPairs() throws Exception {
        AtomicReference<List<Serializable[]>> received = new AtomicReference<>();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.registerRowsEventHandler(new RowsEventHandler() {
            @Override
            public void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) {
                assertSame(RowsAction.UPDATE, action);
                received.set(rows);
            }

            @Override
            public void onComplete() {
            }
        });

        this.binlogSync.handle(Events.tableMap(7L, "shop", "customer", 150L));
        this.binlogSync.handle(Events.rows(EventType.UPDATE_ROWS, 7L, 250L, new Serializable[]{1, "a"}, new Serializable[]{1, "b"}));

        assertEquals(2, received.get().size());
        assertEquals("b", received.get().get(1)[1]);
    }

    @Test
    public void testHandlerFailureStopsPositionAndNotifies() throws Exception {
        List<String> log = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<Exception> failure = new AtomicReference<>();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H1", log));
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H2", log) {
            @Override
            public void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) throws RowsEventHandlerException {
                if (action == RowsAction.DELETE) {
                    throw new RowsEventHandlerException("cannot delete");
                }
                super.onRows(action, table, rows);
            }
        });
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H3", log));
        this.binlogSync.onException(exception -> {
            failure.set(exception);
            failed.countDown();
        });

        this.binlogSync.start();
        this.connection.push(
                Events.tableMap(7L, "shop", "customer", 150L),
                Events.rows(EventType.WRITE_ROWS, 7L, 250L, new Serializable[]{1, "a"}),
                Events.rows(EventType.DELETE_ROWS, 7L, 350L, new Serializable[]{1, "a"}),
                Events.rows(EventType.WRITE_ROWS, 7L, 450L, new Serializable[]{2, "b"})
        );

        assertTrue(failed.await(5L, TimeUnit.SECONDS));
        assertTrue(failure.get() instanceof RowsEventHandlerException);
        assertEquals(BinlogSyncTest.MASTER_STATUS, this.binlogSync.syncedPosition());
        assertEquals(Arrays.asList("H1:insert", "H2:insert", "H3:insert", "H1:delete"), log);

        BinlogSyncTest.await(() -> this.binlogSync.getState() == State.CLOSED);
        assertEquals(BinlogSyncTest.MASTER_STATUS, this.binlogSync.syncedPosition());
    }

    @Test
    public void testResumeAfterHandlerFailureRedeliversTransaction() throws Exception {
        PositionStorage storage = new MemoryPositionStorage();
        List<String> log = new ArrayList<>();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).positionStorage(storage).build();
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H1", log) {
            @Override
            public void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) throws RowsEventHandlerException {
                throw new RowsEventHandlerException("sink unavailable");
            }
        });

        this.binlogSync.handle(Events.query("shop", "BEGIN", 1300L));
        this.binlogSync.handle(Events.tableMap(7L, "shop", "customer", 1400L));

        try {
            this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 7L, 1500L, new Serializable[]{1, "a"}));
            fail("expected RowsEventHandlerException");
        } catch (RowsEventHandlerException exception) {
            assertEquals("sink unavailable", exception.getMessage());
        }

        this.binlogSync.close();
        this.binlogSync = null;

        assertEquals(BinlogSyncTest.MASTER_STATUS, MasterStatusSerializer.deserialize(storage.get(PositionStorage.DEFAULT_PATH)));

        this.connection = new FakeBinlogConnection();
        this.binlogSync = this.builder(BinlogSyncTest.DSN).positionStorage(storage).resumeFromStorage(true).build();
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H1", log));

        assertEquals(BinlogSyncTest.MASTER_STATUS, this.connection.getStart());

        // the server replays the whole transaction from the resumed position
        this.binlogSync.handle(Events.query("shop", "BEGIN", 1300L));
        this.binlogSync.handle(Events.tableMap(7L, "shop", "customer", 1400L));
        this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 7L, 1500L, new Serializable[]{1, "a"}));
        this.binlogSync.handle(Events.xid(9L, 1600L));

        assertEquals(Arrays.asList("H1:insert", "H1:complete"), log);
        assertEquals(new MasterStatus("bin.000001", 1600L), this.binlogSync.syncedPosition());
    }

    @Test
    public void testCommitCompletesHandlers() throws Exception {
        List<String> log = new ArrayList<>();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H1", log));

        this.binlogSync.handle(Events.query("shop", "BEGIN", 100L));
        this.binlogSync.handle(Events.xid(42L, 200L));
        this.binlogSync.handle(Events.query("shop", "COMMIT", 300L));

        assertEquals(Arrays.asList("H1:complete", "H1:complete"), log);
        assertEquals(300L, this.binlogSync.syncedPosition().getPosition());
    }

    @Test
    public void testAlterTableReloadsTable() throws Exception {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();

        this.binlogSync.findTable("t");
        this.binlogSync.findTable("t");

        assertEquals(1, this.loads.get());

        this.binlogSync.handle(Events.query("shop", "ALTER TABLE `shop`.`t` ADD COLUMN x INT", 500L));
        this.binlogSync.findTable("t");

        assertEquals(2, this.loads.get());

        this.binlogSync.handle(Events.query("shop", "ALTER TABLE `other`.`t` ADD COLUMN y INT", 600L));
        this.binlogSync.findTable("t");

        assertEquals(2, this.loads.get());

        this.binlogSync.clearTableCache("t");
        this.binlogSync.findTable("t");

        assertEquals(3, this.loads.get());

        this.binlogSync.clearTableCache();
        this.binlogSync.findTable("t");

        assertEquals(4, this.loads.get());
    }

    @Test
    public void testRowsOfOtherSchemasAndUnknownTablesAreSkipped() throws Exception {
        List<String> log = new ArrayList<>();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.registerRowsEventHandler(new RecordingHandler("H1", log));

        this.binlogSync.handle(Events.tableMap(8L, "other", "customer", 100L));
        this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 8L, 200L, new Serializable[]{1, "a"}));
        this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 99L, 300L, new Serializable[]{1, "a"}));
        this.binlogSync.handle(Events.tableMap(9L, "shop", "missing", 400L));
        this.binlogSync.handle(Events.rows(EventType.WRITE_ROWS, 9L, 500L, new Serializable[]{1, "a"}));

        assertTrue(log.isEmpty());
        assertEquals(1, this.loads.get());
        assertEquals(BinlogSyncTest.MASTER_STATUS, this.binlogSync.syncedPosition());

        this.binlogSync.handle(Events.xid(3L, 600L));

        assertEquals(600L, this.binlogSync.syncedPosition().getPosition());
    }

    @Test
    public void testConcurrentCloseIsIdempotent() throws Exception {
        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.start();

        CyclicBarrier barrier = new CyclicBarrier(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            List<Future<Void>> futures = new ArrayList<>();

            for (int index = 0; index < 2; index++) {
                futures.add(executor.submit(() -> {
                    barrier.await();
                    this.binlogSync.close();
                    return null;
                }));
            }

            for (Future<Void> future : futures) {
                future.get(10L, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        BinlogSyncTest.await(() -> this.binlogSync.getState() == State.CLOSED);

        this.binlogSync.close();

        assertEquals(1, this.connection.getCloseCount());
        assertFalse(this.connection.isOpen());
    }

    @Test
    public void testCloseFlushesPosition() throws Exception {
        PositionStorage storage = new MemoryPositionStorage();

        this.binlogSync = this.builder(BinlogSyncTest.DSN).positionStorage(storage).clock(() -> 0L).build();

        this.binlogSync.handle(Events.xid(1L, 2000L));
        this.binlogSync.handle(Events.xid(2L, 3000L));
        this.binlogSync.close();

        assertEquals(State.CLOSED, this.binlogSync.getState());
        assertEquals(
                new MasterStatus("bin.000001", 3000L),
                MasterStatusSerializer.deserialize(storage.get(PositionStorage.DEFAULT_PATH))
        );
    }

    @Test
    public void testConnectionFailureNotifies() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);

        this.binlogSync = this.builder(BinlogSyncTest.DSN).build();
        this.binlogSync.onException(exception -> failed.countDown());
        this.binlogSync.start();

        this.connection.fail(new IOException("connection reset"));

        assertTrue(failed.await(5L, TimeUnit.SECONDS));
        BinlogSyncTest.await(() -> this.binlogSync.getState() == State.CLOSED);
    }

    private static class RecordingHandler implements RowsEventHandler {
        private final String name;
        private final List<String> log;

        RecordingHandler(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void onRows(RowsAction action, TableSchema table, List<Serializable[]> rows) throws RowsEventHandlerException {
            this.log.add(String.format("%s:%s", this.name, action));
        }

        @Override
        public void onComplete() {
            this.log.add(String.format("%s:complete", this.name));
        }

        @Override
        public String name() {
            return this.name;
        }
    }
}
