package com.replication.binlogsync.supplier.model;

import java.io.Serializable;

/**
 * A decoded binary log event.
 */
public class BinlogEvent implements Serializable {
    private final EventHeader header;
    private final EventData data;

    public BinlogEvent(EventHeader header, EventData data) {
        this.header = header;
        this.data = data;
    }

    public EventHeader getHeader() {
        return this.header;
    }

    public EventType getEventType() {
        return this.header.getEventType();
    }

    /**
     * @return the event payload, {@code null} for event types without one
     */
    @SuppressWarnings("unchecked")
    public <T extends EventData> T getData() {
        return (T) this.data;
    }

    @Override
    public String toString() {
        return String.format("header: { %s } | data: { %s }", this.header, this.data);
    }
}
