package com.booking.realtime.dispatcher.count;

import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.dispatcher.Dispatcher;
import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.visibility.VisibilityResult;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Only counts what would be delivered, per change kind and per admitted subscriber.
 */
public class CountDispatcher implements Dispatcher {
    private final Metrics<?> metrics;
    private final Map<ChangeEventType, Long> eventCounts;

    public CountDispatcher(Metrics<?> metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.eventCounts = new EnumMap<>(ChangeEventType.class);
    }

    @Override
    public synchronized Boolean apply(VisibilityResult result) {
        ChangeEventType type = result.getEvent().getType();

        this.eventCounts.merge(type, 1L, Long::sum);

        this.metrics.incrementCounter(String.format("dispatcher.events.%s", type.name().toLowerCase(Locale.ROOT)), 1L);
        this.metrics.incrementCounter("dispatcher.deliveries", result.getVisibleSubscribers().size());

        return true;
    }

    public synchronized Map<ChangeEventType, Long> getEventCounts() {
        return new EnumMap<>(this.eventCounts);
    }
}
