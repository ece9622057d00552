package com.replication.binlogsync.supplier.model;

public class XidEventData implements EventData {
    private final long xid;

    public XidEventData(long xid) {
        this.xid = xid;
    }

    public long getXid() {
        return this.xid;
    }

    @Override
    public String toString() {
        return String.format("xid: %d", this.xid);
    }
}
