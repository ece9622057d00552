package com.replication.binlogsync.commons.checkpoint;

import java.io.IOException;
import java.util.Map;

/**
 * Key/value sink used to persist the replication position.
 */
public interface PositionStorage {
    String DEFAULT_PATH = "sql/binlogsync/master_position";

    enum Type {
        NONE {
            @Override
            public PositionStorage newInstance(Map<String, Object> configuration) {
                return null;
            }
        },
        MEMORY {
            @Override
            public PositionStorage newInstance(Map<String, Object> configuration) {
                return new MemoryPositionStorage();
            }
        },
        FILE {
            @Override
            public PositionStorage newInstance(Map<String, Object> configuration) {
                return new FilePositionStorage(configuration);
            }
        };

        public abstract PositionStorage newInstance(Map<String, Object> configuration);
    }

    interface Configuration {
        String TYPE = "position.storage.type";
        String PATH = "position.storage.path";
    }

    void set(String path, byte[] value) throws IOException;

    /**
     * @return the stored value, or {@code null} if nothing has been stored under the path
     */
    byte[] get(String path) throws IOException;

    /**
     * @return the configured storage, {@code null} for {@link Type#NONE}
     */
    static PositionStorage build(Map<String, Object> configuration) {
        return Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.NONE.name()).toString().toUpperCase()
        ).newInstance(configuration);
    }
}
