package com.booking.realtime.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;

import java.util.Map;

public class JMXMetrics extends Metrics<JmxReporter> {
    public JMXMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected JmxReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        JmxReporter reporter = JmxReporter.forRegistry(registry)
                .inDomain(String.valueOf(configuration.getOrDefault(Configuration.BASE_PATH, "realtime")))
                .build();

        reporter.start();

        return reporter;
    }
}
