package com.booking.realtime.dispatcher;

import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.dispatcher.console.ConsoleDispatcher;
import com.booking.realtime.dispatcher.count.CountDispatcher;
import com.booking.realtime.model.visibility.VisibilityResult;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.function.Function;

/**
 * Hands visibility results to the delivery layer. Returns {@code true} once the layer accepted
 * the result; the stream is not advanced past a result that was refused.
 */
public interface Dispatcher extends Function<VisibilityResult, Boolean>, Closeable {
    enum Type {
        CONSOLE {
            @Override
            protected Dispatcher newInstance(Map<String, Object> configuration, Metrics<?> metrics) {
                return new ConsoleDispatcher(configuration);
            }
        },
        COUNT {
            @Override
            protected Dispatcher newInstance(Map<String, Object> configuration, Metrics<?> metrics) {
                return new CountDispatcher(metrics);
            }
        };

        protected abstract Dispatcher newInstance(Map<String, Object> configuration, Metrics<?> metrics);
    }

    interface Configuration {
        String TYPE = "dispatcher.type";
    }

    @Override
    default void close() throws IOException {
    }

    static Dispatcher build(Map<String, Object> configuration, Metrics<?> metrics) {
        return Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.CONSOLE.name()).toString()
        ).newInstance(configuration, metrics);
    }
}
