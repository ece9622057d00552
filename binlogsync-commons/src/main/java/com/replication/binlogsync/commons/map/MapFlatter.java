package com.replication.binlogsync.commons.map;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens nested configuration maps (as read from YAML) into dotted keys, so
 * {@code {position: {storage: {type: FILE}}}} becomes {@code position.storage.type=FILE}.
 */
public class MapFlatter {
    private final String delimiter;

    public MapFlatter(String delimiter) {
        this.delimiter = delimiter;
    }

    public Map<String, Object> flattenMap(Map<?, ?> map) {
        Map<String, Object> flattenMap = new LinkedHashMap<>();

        this.flattenMap(null, map, flattenMap);

        return flattenMap;
    }

    private void flattenMap(String path, Map<?, ?> map, Map<String, Object> flattenMap) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String flattenPath = (path != null) ? (path + this.delimiter + key) : (key);

            if (entry.getValue() instanceof Map) {
                this.flattenMap(flattenPath, (Map<?, ?>) entry.getValue(), flattenMap);
            } else if (entry.getValue() != null) {
                flattenMap.put(flattenPath, entry.getValue());
            }
        }
    }
}
