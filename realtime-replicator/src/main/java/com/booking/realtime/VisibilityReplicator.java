package com.booking.realtime;

import com.booking.realtime.catalog.CachingTableSecurityCatalog;
import com.booking.realtime.catalog.JdbcRowSecurityAdmission;
import com.booking.realtime.catalog.JdbcSubscriptionRegistry;
import com.booking.realtime.catalog.JdbcTableSecurityCatalog;
import com.booking.realtime.commons.checkpoint.CheckpointStorage;
import com.booking.realtime.commons.jdbc.PostgresDataSource;
import com.booking.realtime.commons.map.MapFlatter;
import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.controller.WebServer;
import com.booking.realtime.dispatcher.Dispatcher;
import com.booking.realtime.stream.StreamCursor;
import com.booking.realtime.visibility.RowSecurityAdmission;
import com.booking.realtime.visibility.VisibilityEngine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.dbcp2.BasicDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class VisibilityReplicator {
    private static final Logger LOG = LogManager.getLogger(VisibilityReplicator.class);
    private static final String COMMAND_LINE_SYNTAX = "java -jar realtime-replicator-<version>.jar";

    private final BasicDataSource dataSource;
    private final RowSecurityAdmission admission;
    private final VisibilityEngine engine;
    private final StreamCursor cursor;
    private final Dispatcher dispatcher;
    private final Metrics<?> metrics;
    private final VisibilityPipeline pipeline;
    private final WebServer webServer;

    public VisibilityReplicator(final Map<String, Object> configuration) throws IOException {
        this.metrics = Metrics.build(configuration);
        this.dataSource = PostgresDataSource.build(configuration);

        this.admission = JdbcRowSecurityAdmission.build(configuration, this.dataSource);
        this.engine = VisibilityEngine.build(
                configuration,
                JdbcSubscriptionRegistry.build(configuration, this.dataSource),
                CachingTableSecurityCatalog.build(configuration, new JdbcTableSecurityCatalog(this.dataSource)),
                this.admission,
                this.metrics
        );

        this.cursor = StreamCursor.build(configuration);
        this.dispatcher = Dispatcher.build(configuration, this.metrics);

        this.pipeline = VisibilityPipeline.build(
                configuration,
                this.cursor,
                this.engine,
                this.dispatcher,
                CheckpointStorage.build(configuration),
                this.metrics
        );

        this.webServer = WebServer.build(configuration, this.pipeline::isRunning);
    }

    public void start() {
        VisibilityReplicator.LOG.info("starting webserver");

        try {
            this.webServer.start();
        } catch (IOException exception) {
            VisibilityReplicator.LOG.error("error starting webserver", exception);
        }

        this.pipeline.start();
    }

    public void wait(long timeout, TimeUnit unit) throws InterruptedException {
        while (!this.pipeline.wait(timeout, unit)) {
            VisibilityReplicator.LOG.debug("pipeline still running");
        }
    }

    public void stop() {
        VisibilityReplicator.LOG.info("stopping pipeline");
        this.pipeline.stop();

        try {
            if (!this.pipeline.wait(10L, TimeUnit.SECONDS)) {
                VisibilityReplicator.LOG.warn("pipeline did not stop in time");
            }
        } catch (InterruptedException exception) {
            VisibilityReplicator.LOG.warn("interrupted while stopping pipeline");
            Thread.currentThread().interrupt();
        }

        try {
            VisibilityReplicator.LOG.info("stopping web server");
            this.webServer.stop();

            VisibilityReplicator.LOG.info("closing dispatcher");
            this.dispatcher.close();

            VisibilityReplicator.LOG.info("closing stream cursor");
            this.cursor.close();

            VisibilityReplicator.LOG.info("closing visibility engine");
            this.engine.close();
            this.admission.close();

            VisibilityReplicator.LOG.info("closing metrics sink");
            this.metrics.close();
        } catch (IOException exception) {
            VisibilityReplicator.LOG.error("error stopping replicator", exception);
        }

        try {
            this.dataSource.close();
        } catch (SQLException exception) {
            VisibilityReplicator.LOG.error("error closing connection pool", exception);
        }
    }

    /*
     * Start the JVM with the argument -Djava.util.logging.manager=org.apache.logging.log4j.jul.LogManager
     */
    public static void main(String[] arguments) {
        Options options = VisibilityReplicator.options();

        try {
            CommandLine line = new DefaultParser().parse(options, arguments);

            if (line.hasOption("help")) {
                new HelpFormatter().printHelp(VisibilityReplicator.COMMAND_LINE_SYNTAX, options);
            } else {
                Map<String, Object> configuration = VisibilityReplicator.configuration(line);

                VisibilityReplicator replicator = new VisibilityReplicator(configuration);

                Runtime.getRuntime().addShutdownHook(new Thread(replicator::stop));

                replicator.start();
                replicator.wait(1L, TimeUnit.MINUTES);
            }
        } catch (Exception exception) {
            LOG.error("Error in replicator", exception);
            new HelpFormatter().printHelp(VisibilityReplicator.COMMAND_LINE_SYNTAX, null, options, exception.getMessage());
        }
    }

    static Options options() {
        Options options = new Options();

        options.addOption(Option.builder().longOpt("help").desc("print the help message").build());
        options.addOption(Option.builder().longOpt("config").argName("key-value").desc("the configuration to be used with the format <key>=<value>").hasArgs().build());
        options.addOption(Option.builder().longOpt("config-file").argName("filename").desc("the configuration file to be used (YAML)").hasArg().build());
        options.addOption(Option.builder().longOpt("secret-file").argName("filename").desc("the secret file which has the Postgres user/password config (JSON)").hasArg().build());
        options.addOption(Option.builder().longOpt("stream").argName("stream").desc("the stream cursor to be used").hasArg().build());
        options.addOption(Option.builder().longOpt("dispatcher").argName("dispatcher").desc("the dispatcher to be used").hasArg().build());

        return options;
    }

    static Map<String, Object> configuration(CommandLine line) throws IOException {
        Map<String, Object> configuration = new HashMap<>();

        if (line.hasOption("config-file")) {
            configuration.putAll(new MapFlatter(".").flattenMap(new ObjectMapper(new YAMLFactory()).readValue(
                    new File(line.getOptionValue("config-file")),
                    new TypeReference<Map<String, Object>>() {
                    }
            )));
        }

        if (line.hasOption("secret-file")) {
            configuration.putAll(new ObjectMapper().readValue(
                    new File(line.getOptionValue("secret-file")),
                    new TypeReference<Map<String, String>>() {
                    }
            ));
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

        if (line.hasOption("stream")) {
            configuration.put(StreamCursor.Configuration.TYPE, line.getOptionValue("stream").toUpperCase(Locale.ROOT));
        }

        if (line.hasOption("dispatcher")) {
            configuration.put(Dispatcher.Configuration.TYPE, line.getOptionValue("dispatcher").toUpperCase(Locale.ROOT));
        }

        return configuration;
    }
}
