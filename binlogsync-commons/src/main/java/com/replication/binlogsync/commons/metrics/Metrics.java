package com.replication.binlogsync.commons.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Metric registry owned by one replication client together with the reporter publishing it.
 */
public abstract class Metrics implements Closeable {
    private static final Logger LOG = LogManager.getLogger(Metrics.class);

    public enum Type {
        NONE {
            @Override
            protected Metrics newInstance(Map<String, Object> configuration) {
                return new NoneMetrics(configuration);
            }
        },
        CONSOLE {
            @Override
            protected Metrics newInstance(Map<String, Object> configuration) {
                return new ConsoleMetrics(configuration);
            }
        },
        JMX {
            @Override
            protected Metrics newInstance(Map<String, Object> configuration) {
                return new JMXMetrics(configuration);
            }
        };

        protected abstract Metrics newInstance(Map<String, Object> configuration);
    }

    public interface Configuration {
        String TYPE = "metrics.type";
        String BASE_PATH = "metrics.base_path";
    }

    private final MetricRegistry registry;
    private final Closeable reporter;
    private final String basePath;

    protected Metrics(Map<String, Object> configuration) {
        this.registry = new MetricRegistry();
        this.basePath = String.valueOf(configuration.getOrDefault(Configuration.BASE_PATH, "binlogsync"));
        this.reporter = this.getReporter(configuration, this.registry);
    }

    public MetricRegistry getRegistry() {
        return this.registry;
    }

    public String basePath() {
        return this.basePath;
    }

    public Counter counter(String name) {
        return this.registry.counter(MetricRegistry.name(this.basePath, name));
    }

    public Meter meter(String name) {
        return this.registry.meter(MetricRegistry.name(this.basePath, name));
    }

    public <T extends Metric> T register(String name, T metric) {
        final String fullName = MetricRegistry.name(this.basePath, name);

        if (this.registry.remove(fullName)) {
            Metrics.LOG.warn("Metric {} already registered.", fullName);
        }

        return this.registry.register(fullName, metric);
    }

    public <T> Gauge<T> gauge(String name, Gauge<T> gauge) {
        return this.register(name, gauge);
    }

    @Override
    public void close() throws IOException {
        if (this.reporter != null) {
            this.reporter.close();
        }
    }

    /**
     * @return the started reporter, or {@code null} if nothing is reported
     */
    protected abstract Closeable getReporter(Map<String, Object> configuration, MetricRegistry registry);

    public static Metrics build(Map<String, Object> configuration) {
        return Metrics.Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.NONE.name()).toString().toUpperCase()
        ).newInstance(configuration);
    }

    public static Metrics none() {
        return Metrics.build(Collections.emptyMap());
    }
}
