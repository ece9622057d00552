package com.replication.binlogsync.commons.metrics;

import com.codahale.metrics.MetricRegistry;

import java.io.Closeable;
import java.util.Map;

/**
 * Keeps the registry for in-process inspection without reporting it anywhere.
 */
public class NoneMetrics extends Metrics {
    public NoneMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Closeable getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        return null;
    }
}
