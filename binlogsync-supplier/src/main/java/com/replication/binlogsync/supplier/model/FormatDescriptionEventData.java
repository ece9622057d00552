package com.replication.binlogsync.supplier.model;

public class FormatDescriptionEventData implements EventData {
    private final int binlogVersion;
    private final String serverVersion;

    public FormatDescriptionEventData(int binlogVersion, String serverVersion) {
        this.binlogVersion = binlogVersion;
        this.serverVersion = serverVersion;
    }

    public int getBinlogVersion() {
        return this.binlogVersion;
    }

    public String getServerVersion() {
        return this.serverVersion;
    }

    @Override
    public String toString() {
        return String.format("binlogVersion: %d | serverVersion: %s", this.binlogVersion, this.serverVersion);
    }
}
