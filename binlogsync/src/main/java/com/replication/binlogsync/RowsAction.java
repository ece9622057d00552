package com.replication.binlogsync;

import com.replication.binlogsync.supplier.model.EventType;

public enum RowsAction {
    INSERT("insert"),
    UPDATE("update"),
    DELETE("delete");

    private final String code;

    RowsAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return this.code;
    }

    public static RowsAction of(EventType eventType) {
        switch (eventType) {
            case WRITE_ROWS:
                return RowsAction.INSERT;
            case UPDATE_ROWS:
                return RowsAction.UPDATE;
            case DELETE_ROWS:
                return RowsAction.DELETE;
            default:
                throw new IllegalArgumentException(String.format("not a rows event: %s", eventType));
        }
    }

    @Override
    public String toString() {
        return this.code;
    }
}
