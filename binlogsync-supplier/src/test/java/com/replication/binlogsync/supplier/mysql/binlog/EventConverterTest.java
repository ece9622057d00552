package com.replication.binlogsync.supplier.mysql.binlog;

import com.github.shyiko.mysql.binlog.event.Event;
import com.github.shyiko.mysql.binlog.event.EventHeaderV4;
import com.github.shyiko.mysql.binlog.event.UpdateRowsEventData;
import com.github.shyiko.mysql.binlog.event.WriteRowsEventData;

import com.replication.binlogsync.supplier.model.BinlogEvent;
import com.replication.binlogsync.supplier.model.EventType;
import com.replication.binlogsync.supplier.model.QueryEventData;
import com.replication.binlogsync.supplier.model.RotateEventData;
import com.replication.binlogsync.supplier.model.RowsEventData;
import com.replication.binlogsync.supplier.model.TableMapEventData;

import org.junit.Test;

import java.io.Serializable;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class EventConverterTest {
    private final EventConverter converter = new EventConverter();

    private static EventHeaderV4 header(com.github.shyiko.mysql.binlog.event.EventType eventType, long position, long nextPosition) {
        EventHeaderV4 header = new EventHeaderV4();

        header.setEventType(eventType);
        header.setTimestamp(1546300800000L);
        header.setServerId(1L);
        header.setNextPosition(nextPosition);
        header.setEventLength(nextPosition - position);

        return header;
    }

    @Test
    public void testRotate() {
        com.github.shyiko.mysql.binlog.event.RotateEventData data = new com.github.shyiko.mysql.binlog.event.RotateEventData();
        data.setBinlogFilename("mysql-bin.000007");
        data.setBinlogPosition(4L);

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.ROTATE, 0L, 0L), data
        ));

        assertEquals(EventType.ROTATE, event.getEventType());

        RotateEventData rotate = event.getData();

        assertEquals("mysql-bin.000007", rotate.getBinlogFilename());
        assertEquals(4L, rotate.getBinlogPosition());
        assertEquals(0L, event.getHeader().getNextPosition());
    }

    @Test
    public void testTableMap() {
        com.github.shyiko.mysql.binlog.event.TableMapEventData data = new com.github.shyiko.mysql.binlog.event.TableMapEventData();
        data.setTableId(72L);
        data.setDatabase("shop");
        data.setTable("orders");

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.TABLE_MAP, 200L, 260L), data
        ));

        TableMapEventData tableMap = event.getData();

        assertEquals(EventType.TABLE_MAP, event.getEventType());
        assertEquals(72L, tableMap.getTableId());
        assertEquals("shop", tableMap.getDatabase());
        assertEquals("orders", tableMap.getTable());
        assertEquals(200L, event.getHeader().getPosition());
        assertEquals(260L, event.getHeader().getNextPosition());
    }

    @Test
    public void testExtendedWriteRowsMapToWriteRows() {
        WriteRowsEventData data = new WriteRowsEventData();
        data.setTableId(72L);
        data.setRows(Collections.singletonList(new Serializable[]{1, "a"}));

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.EXT_WRITE_ROWS, 260L, 320L), data
        ));

        RowsEventData rows = event.getData();

        assertEquals(EventType.WRITE_ROWS, event.getEventType());
        assertEquals(72L, rows.getTableId());
        assertArrayEquals(new Serializable[]{1, "a"}, rows.getRows().get(0));
    }

    @Test
    public void testUpdateRowsAreFlattenedToBeforeAfterPairs() {
        List<Map.Entry<Serializable[], Serializable[]>> updates = Arrays.asList(
                new AbstractMap.SimpleEntry<>(new Serializable[]{1, "a"}, new Serializable[]{1, "b"}),
                new AbstractMap.SimpleEntry<>(new Serializable[]{2, "c"}, new Serializable[]{2, "d"})
        );

        UpdateRowsEventData data = new UpdateRowsEventData();
        data.setTableId(72L);
        data.setRows(updates);

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.UPDATE_ROWS, 260L, 400L), data
        ));

        RowsEventData rows = event.getData();

        assertEquals(EventType.UPDATE_ROWS, event.getEventType());
        assertEquals(4, rows.getRows().size());
        assertArrayEquals(new Serializable[]{1, "a"}, rows.getRows().get(0));
        assertArrayEquals(new Serializable[]{1, "b"}, rows.getRows().get(1));
        assertArrayEquals(new Serializable[]{2, "c"}, rows.getRows().get(2));
        assertArrayEquals(new Serializable[]{2, "d"}, rows.getRows().get(3));
    }

    @Test
    public void testQuery() {
        com.github.shyiko.mysql.binlog.event.QueryEventData data = new com.github.shyiko.mysql.binlog.event.QueryEventData();
        data.setDatabase("shop");
        data.setSql("ALTER TABLE orders ADD COLUMN note TEXT");

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.QUERY, 400L, 520L), data
        ));

        QueryEventData query = event.getData();

        assertEquals(EventType.QUERY, event.getEventType());
        assertEquals("shop", query.getDatabase());
        assertEquals("ALTER TABLE orders ADD COLUMN note TEXT", query.getSql());
    }

    @Test
    public void testUnhandledTypesAreUnknown() {
        assertEquals(EventType.UNKNOWN, EventConverter.convert(com.github.shyiko.mysql.binlog.event.EventType.STOP));
        assertEquals(EventType.UNKNOWN, EventConverter.convert((com.github.shyiko.mysql.binlog.event.EventType) null));
        assertEquals(EventType.HEARTBEAT, EventConverter.convert(com.github.shyiko.mysql.binlog.event.EventType.HEARTBEAT));

        BinlogEvent event = this.converter.convert(new Event(
                EventConverterTest.header(com.github.shyiko.mysql.binlog.event.EventType.STOP, 600L, 623L), null
        ));

        assertEquals(EventType.UNKNOWN, event.getEventType());
        assertNull(event.getData());
    }
}
