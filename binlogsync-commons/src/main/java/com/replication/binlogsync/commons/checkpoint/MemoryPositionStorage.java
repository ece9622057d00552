package com.replication.binlogsync.commons.checkpoint;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryPositionStorage implements PositionStorage {
    private final Map<String, byte[]> values;

    public MemoryPositionStorage() {
        this.values = new ConcurrentHashMap<>();
    }

    @Override
    public void set(String path, byte[] value) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(value);
        this.values.put(path, value.clone());
    }

    @Override
    public byte[] get(String path) {
        byte[] value = this.values.get(path);
        return (value != null) ? (value.clone()) : (null);
    }
}
