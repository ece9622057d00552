package com.replication.binlogsync.supplier;

import java.io.IOException;

public class ConnectionClosedException extends IOException {
    public ConnectionClosedException(String message) {
        super(message);
    }
}
