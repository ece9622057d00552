package com.replication.binlogsync.supplier.model;

public class RotateEventData implements EventData {
    private final String binlogFilename;
    private final long binlogPosition;

    public RotateEventData(String binlogFilename, long binlogPosition) {
        this.binlogFilename = binlogFilename;
        this.binlogPosition = binlogPosition;
    }

    public String getBinlogFilename() {
        return this.binlogFilename;
    }

    public long getBinlogPosition() {
        return this.binlogPosition;
    }

    @Override
    public String toString() {
        return String.format("binlogFilename: %s | binlogPosition: %d", this.binlogFilename, this.binlogPosition);
    }
}
