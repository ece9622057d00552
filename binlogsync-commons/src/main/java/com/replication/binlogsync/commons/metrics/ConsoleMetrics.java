package com.replication.binlogsync.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class ConsoleMetrics extends Metrics {
    public interface Configuration {
        String PERIOD = "metrics.console.period";
    }

    public ConsoleMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Closeable getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        long period = Long.parseLong(configuration.getOrDefault(Configuration.PERIOD, "60").toString());

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        reporter.start(period, TimeUnit.SECONDS);

        return reporter;
    }
}
