package com.booking.realtime.commons.metrics;

import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Reporter;
import com.codahale.metrics.Timer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

public abstract class Metrics<CloseableReporter extends Closeable & Reporter> implements Closeable {
    private static final Logger LOG = LogManager.getLogger(Metrics.class);

    public enum Type {
        CONSOLE {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new ConsoleMetrics(configuration);
            }
        },
        JMX {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new JMXMetrics(configuration);
            }
        };

        protected abstract Metrics<?> newInstance(Map<String, Object> configuration);
    }

    public interface Configuration {
        String TYPE = "metrics.applier.type";
        String BASE_PATH = "metrics.applier.base_path";
        String REPORT_PERIOD = "metrics.applier.report.period.seconds";
    }

    private final MetricRegistry registry;
    private final CloseableReporter reporter;
    private final String basePath;

    public Metrics(Map<String, Object> configuration) {
        this.registry = new MetricRegistry();
        this.reporter = this.getReporter(configuration, this.registry);
        this.basePath = String.valueOf(configuration.getOrDefault(Configuration.BASE_PATH, "realtime"));
    }

    public MetricRegistry getRegistry() {
        return this.registry;
    }

    public void incrementCounter(String name, long val) {
        this.registry.counter(MetricRegistry.name(this.basePath, name)).inc(val);
    }

    public long getCount(String name) {
        return this.registry.counter(MetricRegistry.name(this.basePath, name)).getCount();
    }

    public Timer timer(String name) {
        return this.registry.timer(MetricRegistry.name(this.basePath, name));
    }

    public <T extends Metric> T register(String name, T metric) {
        final String fullName = MetricRegistry.name(this.basePath, name);

        if (this.registry.remove(fullName)) {
            LOG.warn(String.format("Metric %s already registered.", fullName));
        }

        T response = this.registry.register(fullName, metric);

        LOG.info(String.format("Metric %s registered", fullName));

        return response;
    }

    public String basePath() {
        return this.basePath;
    }

    @Override
    public void close() throws IOException {
        this.reporter.close();
    }

    protected abstract CloseableReporter getReporter(Map<String, Object> configuration, MetricRegistry registry);

    public static Metrics<?> build(Map<String, Object> configuration) {
        return Metrics.Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.CONSOLE.name()).toString()
        ).newInstance(configuration);
    }
}
