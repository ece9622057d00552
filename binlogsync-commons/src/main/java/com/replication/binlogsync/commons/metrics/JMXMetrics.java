package com.replication.binlogsync.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;

import java.io.Closeable;
import java.util.Map;

public class JMXMetrics extends Metrics {
    public JMXMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Closeable getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        JmxReporter reporter = JmxReporter.forRegistry(registry).inDomain(this.basePath()).build();

        reporter.start();

        return reporter;
    }
}
