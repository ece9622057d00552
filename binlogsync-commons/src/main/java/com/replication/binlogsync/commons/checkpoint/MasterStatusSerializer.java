package com.replication.binlogsync.commons.checkpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public final class MasterStatusSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private MasterStatusSerializer() {
    }

    public static byte[] serialize(MasterStatus status) throws IOException {
        return MasterStatusSerializer.MAPPER.writeValueAsBytes(status);
    }

    /**
     * @return the decoded status, or {@code null} for an empty value
     */
    public static MasterStatus deserialize(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        return MasterStatusSerializer.MAPPER.readValue(bytes, MasterStatus.class);
    }
}
