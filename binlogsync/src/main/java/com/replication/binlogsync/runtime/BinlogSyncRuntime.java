package com.replication.binlogsync.runtime;

import com.replication.binlogsync.BinlogSync;
import com.replication.binlogsync.commons.checkpoint.PositionStorage;
import com.replication.binlogsync.commons.map.MapFlatter;
import com.replication.binlogsync.commons.metrics.Metrics;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point: replicates one schema and logs its row changes.
 */
public class BinlogSyncRuntime {
    public interface Configuration {
        String DSN = "binlogsync.dsn";
        String POSITION_RESUME = "binlogsync.position.resume";
        String CONNECT_TIMEOUT = "binlogsync.connect.timeout";
        String QUEUE_SIZE = "binlogsync.queue.size";
        String BINLOG_ROW_IMAGE = "binlogsync.binlog.row_image";
    }

    private static final Logger LOG = LogManager.getLogger(BinlogSyncRuntime.class);
    private static final String COMMAND_LINE_SYNTAX = "java -jar binlogsync-<version>.jar";

    private final BinlogSync binlogSync;
    private final CountDownLatch closed;

    public BinlogSyncRuntime(Map<String, Object> configuration) throws Exception {
        Object dsn = configuration.get(Configuration.DSN);

        Objects.requireNonNull(dsn, String.format("Configuration required: %s", Configuration.DSN));

        boolean resume = Boolean.parseBoolean(configuration.getOrDefault(Configuration.POSITION_RESUME, false).toString());
        long connectTimeout = Long.parseLong(configuration.getOrDefault(Configuration.CONNECT_TIMEOUT, "10000").toString());
        int queueSize = Integer.parseInt(configuration.getOrDefault(Configuration.QUEUE_SIZE, "10000").toString());
        Object rowImage = configuration.get(Configuration.BINLOG_ROW_IMAGE);

        this.closed = new CountDownLatch(1);
        this.binlogSync = BinlogSync.builder(dsn.toString())
                .positionStorage(PositionStorage.build(configuration))
                .positionPath(configuration.getOrDefault(PositionStorage.Configuration.PATH, PositionStorage.DEFAULT_PATH).toString())
                .resumeFromStorage(resume)
                .metrics(Metrics.build(configuration))
                .connectTimeout(connectTimeout)
                .queueSize(queueSize)
                .build();

        try {
            if (rowImage != null) {
                this.binlogSync.checkBinlogRowImage(rowImage.toString());
            }
        } catch (Exception exception) {
            this.binlogSync.close();
            throw exception;
        }

        this.binlogSync.registerRowsEventHandler(new LoggingRowsEventHandler());
        this.binlogSync.onException(exception -> {
            BinlogSyncRuntime.LOG.error("binlog sync failed", exception);
            this.closed.countDown();
        });
    }

    public void start() {
        BinlogSyncRuntime.LOG.info("starting binlog sync on schema {}", this.binlogSync.getSchema());
        this.binlogSync.start();
    }

    public void stop() {
        try {
            this.binlogSync.close();
        } catch (IOException exception) {
            BinlogSyncRuntime.LOG.error("error stopping binlog sync", exception);
        } finally {
            this.closed.countDown();
        }
    }

    public void await() throws InterruptedException {
        this.closed.await();
    }

    static Options getOptions() {
        Options options = new Options();

        options.addOption(Option.builder().longOpt("help").desc("print the help message").build());
        options.addOption(Option.builder().longOpt("dsn").argName("dsn").desc("the MySQL DSN, user:password@tcp(host:port)/schema?params").hasArg().build());
        options.addOption(Option.builder().longOpt("config").argName("key-value").desc("the configuration to be used with the format <key>=<value>").hasArgs().build());
        options.addOption(Option.builder().longOpt("config-file").argName("filename").desc("the configuration file to be used (YAML)").hasArg().build());

        return options;
    }

    static Map<String, Object> getConfiguration(CommandLine line) throws IOException {
        Map<String, Object> configuration = new HashMap<>();

        if (line.hasOption("config-file")) {
            configuration.putAll(new MapFlatter(".").flattenMap(new ObjectMapper(new YAMLFactory()).readValue(
                    new File(line.getOptionValue("config-file")),
                    new TypeReference<Map<String, Object>>() {
                    }
            )));
        }

        if (line.hasOption("config")) {
            for (String keyValue : line.getOptionValues("config")) {
                int startIndex = keyValue.indexOf('=');

                if (startIndex > 0) {
                    int endIndex = startIndex + 1;

                    if (endIndex < keyValue.length()) {
                        configuration.put(keyValue.substring(0, startIndex), keyValue.substring(endIndex));
                    }
                }
            }
        }

        if (line.hasOption("dsn")) {
            configuration.put(Configuration.DSN, line.getOptionValue("dsn"));
        }

        return configuration;
    }

    static CommandLine parse(Options options, String[] arguments) throws ParseException {
        return new DefaultParser().parse(options, arguments);
    }

    public static void main(String[] arguments) {
        Options options = BinlogSyncRuntime.getOptions();

        try {
            CommandLine line = BinlogSyncRuntime.parse(options, arguments);

            if (line.hasOption("help")) {
                new HelpFormatter().printHelp(BinlogSyncRuntime.COMMAND_LINE_SYNTAX, options);
            } else {
                BinlogSyncRuntime runtime = new BinlogSyncRuntime(BinlogSyncRuntime.getConfiguration(line));

                Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop));

                runtime.start();
                runtime.await();
            }
        } catch (Exception exception) {
            BinlogSyncRuntime.LOG.error("Error in binlog sync", exception);
            new HelpFormatter().printHelp(BinlogSyncRuntime.COMMAND_LINE_SYNTAX, null, options, exception.getMessage());
        }
    }
}
