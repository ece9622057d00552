package com.replication.binlogsync.supplier.model;

import java.io.Serializable;

public class EventHeader implements Serializable {
    private final EventType eventType;
    private final long timestamp;
    private final long serverId;
    private final long position;
    private final long nextPosition;

    public EventHeader(EventType eventType, long timestamp, long serverId, long position, long nextPosition) {
        this.eventType = eventType;
        this.timestamp = timestamp;
        this.serverId = serverId;
        this.position = position;
        this.nextPosition = nextPosition;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public long getTimestamp() {
        return this.timestamp;
    }

    public long getServerId() {
        return this.serverId;
    }

    /**
     * @return offset of this event inside the current binlog file
     */
    public long getPosition() {
        return this.position;
    }

    /**
     * @return offset of the event following this one, {@code 0} when the server did not provide it
     */
    public long getNextPosition() {
        return this.nextPosition;
    }

    @Override
    public String toString() {
        return String.format("type: %s | timestamp: %d | serverId: %d | position: %d | nextPosition: %d",
                this.eventType, this.timestamp, this.serverId, this.position, this.nextPosition);
    }
}
