package com.booking.realtime.commons.metrics;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

public class ConsoleMetrics extends Metrics<Slf4jReporter> {

    public ConsoleMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Slf4jReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        long period = Long.parseLong(configuration.getOrDefault(Configuration.REPORT_PERIOD, "60").toString());

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        if (period > 0) {
            reporter.start(period, TimeUnit.SECONDS);
        }

        return reporter;
    }
}
