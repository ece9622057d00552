package com.replication.binlogsync.supplier.mysql.binlog;

import com.github.shyiko.mysql.binlog.event.DeleteRowsEventData;
import com.github.shyiko.mysql.binlog.event.Event;
import com.github.shyiko.mysql.binlog.event.EventHeaderV4;
import com.github.shyiko.mysql.binlog.event.UpdateRowsEventData;
import com.github.shyiko.mysql.binlog.event.WriteRowsEventData;

import com.replication.binlogsync.supplier.model.BinlogEvent;
import com.replication.binlogsync.supplier.model.EventData;
import com.replication.binlogsync.supplier.model.EventHeader;
import com.replication.binlogsync.supplier.model.EventType;
import com.replication.binlogsync.supplier.model.FormatDescriptionEventData;
import com.replication.binlogsync.supplier.model.QueryEventData;
import com.replication.binlogsync.supplier.model.RotateEventData;
import com.replication.binlogsync.supplier.model.RowsEventData;
import com.replication.binlogsync.supplier.model.TableMapEventData;
import com.replication.binlogsync.supplier.model.XidEventData;

/**
 * Translates events decoded by mysql-binlog-connector-java into the client's own event model.
 */
public class EventConverter {

    public BinlogEvent convert(Event event) {
        com.github.shyiko.mysql.binlog.event.EventHeader rawHeader = event.getHeader();
        EventType eventType = EventConverter.convert(rawHeader.getEventType());

        long position = 0L;
        long nextPosition = 0L;

        if (rawHeader instanceof EventHeaderV4) {
            EventHeaderV4 headerV4 = (EventHeaderV4) rawHeader;
            nextPosition = headerV4.getNextPosition();
            position = (nextPosition > 0L) ? (headerV4.getPosition()) : (0L);
        }

        EventHeader header = new EventHeader(
                eventType,
                rawHeader.getTimestamp(),
                (rawHeader instanceof EventHeaderV4) ? (((EventHeaderV4) rawHeader).getServerId()) : (0L),
                position,
                nextPosition
        );

        return new BinlogEvent(header, this.convertData(eventType, event.getData()));
    }

    private EventData convertData(EventType eventType, com.github.shyiko.mysql.binlog.event.EventData data) {
        if (data == null) {
            return null;
        }

        switch (eventType) {
            case ROTATE: {
                com.github.shyiko.mysql.binlog.event.RotateEventData rotate = (com.github.shyiko.mysql.binlog.event.RotateEventData) data;
                return new RotateEventData(rotate.getBinlogFilename(), rotate.getBinlogPosition());
            }
            case TABLE_MAP: {
                com.github.shyiko.mysql.binlog.event.TableMapEventData tableMap = (com.github.shyiko.mysql.binlog.event.TableMapEventData) data;
                return new TableMapEventData(tableMap.getTableId(), tableMap.getDatabase(), tableMap.getTable());
            }
            case WRITE_ROWS: {
                WriteRowsEventData rows = (WriteRowsEventData) data;
                return new RowsEventData(rows.getTableId(), rows.getRows());
            }
            case UPDATE_ROWS: {
                UpdateRowsEventData rows = (UpdateRowsEventData) data;
                return RowsEventData.ofUpdates(rows.getTableId(), rows.getRows());
            }
            case DELETE_ROWS: {
                DeleteRowsEventData rows = (DeleteRowsEventData) data;
                return new RowsEventData(rows.getTableId(), rows.getRows());
            }
            case QUERY: {
                com.github.shyiko.mysql.binlog.event.QueryEventData query = (com.github.shyiko.mysql.binlog.event.QueryEventData) data;
                return new QueryEventData(query.getDatabase(), query.getSql());
            }
            case XID:
                return new XidEventData(((com.github.shyiko.mysql.binlog.event.XidEventData) data).getXid());
            case FORMAT_DESCRIPTION: {
                com.github.shyiko.mysql.binlog.event.FormatDescriptionEventData format = (com.github.shyiko.mysql.binlog.event.FormatDescriptionEventData) data;
                return new FormatDescriptionEventData(format.getBinlogVersion(), format.getServerVersion());
            }
            default:
                return null;
        }
    }

    public static EventType convert(com.github.shyiko.mysql.binlog.event.EventType eventType) {
        if (eventType == null) {
            return EventType.UNKNOWN;
        }

        switch (eventType) {
            case QUERY:
                return EventType.QUERY;
            case ROTATE:
                return EventType.ROTATE;
            case FORMAT_DESCRIPTION:
                return EventType.FORMAT_DESCRIPTION;
            case XID:
                return EventType.XID;
            case TABLE_MAP:
                return EventType.TABLE_MAP;
            case WRITE_ROWS:
            case EXT_WRITE_ROWS:
                return EventType.WRITE_ROWS;
            case UPDATE_ROWS:
            case EXT_UPDATE_ROWS:
                return EventType.UPDATE_ROWS;
            case DELETE_ROWS:
            case EXT_DELETE_ROWS:
                return EventType.DELETE_ROWS;
            case HEARTBEAT:
                return EventType.HEARTBEAT;
            case GTID:
                return EventType.GTID;
            default:
                return EventType.UNKNOWN;
        }
    }
}
