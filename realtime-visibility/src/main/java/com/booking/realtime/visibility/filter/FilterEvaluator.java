package com.booking.realtime.visibility.filter;

import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.subscription.UserDefinedFilter;
import com.booking.realtime.model.visibility.VisibilityError;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Narrows the subscribers admitted by row level security down to those whose own filters
 * match the change. A subscriber with several subscriptions on the same entity receives the
 * change when any one of them matches. All filters of one subscription must hold.
 */
public class FilterEvaluator {
    private static final Logger LOG = LogManager.getLogger(FilterEvaluator.class);

    public interface Configuration {
        String DELETE_FILTER_MODE = "visibility.delete.filter.mode";
    }

    private final ColumnValueComparator comparator;
    private final DeleteFilterMode deleteFilterMode;

    public FilterEvaluator(ColumnValueComparator comparator, DeleteFilterMode deleteFilterMode) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.deleteFilterMode = Objects.requireNonNull(deleteFilterMode, "deleteFilterMode");
    }

    public FilterEvaluator(Map<String, Object> configuration) {
        this(
                new ColumnValueComparator(),
                DeleteFilterMode.valueOf(
                        configuration.getOrDefault(Configuration.DELETE_FILTER_MODE, DeleteFilterMode.SKIP.name()).toString()
                )
        );
    }

    public Set<UUID> evaluate(ChangeEvent event, Set<UUID> admitted, Collection<Subscription> subscriptions, List<VisibilityError> errors) {
        if (admitted.isEmpty()) {
            return Collections.emptySet();
        }

        switch (event.getType()) {
            case TRUNCATE:
                return new LinkedHashSet<>(admitted);
            case DELETE:
                if (this.deleteFilterMode == DeleteFilterMode.SKIP) {
                    return new LinkedHashSet<>(admitted);
                }
                break;
            default:
                break;
        }

        Set<UUID> visible = new LinkedHashSet<>();

        for (Subscription subscription : subscriptions) {
            UUID subscriber = subscription.getUserId();

            if (!admitted.contains(subscriber) || visible.contains(subscriber)) {
                continue;
            }

            if (!subscription.hasFilters()) {
                visible.add(subscriber);
                continue;
            }

            if (event.getType() == ChangeEventType.DELETE && this.deleteFilterMode == DeleteFilterMode.EXCLUDE) {
                continue;
            }

            try {
                if (this.matches(event, subscription.getFilters())) {
                    visible.add(subscriber);
                }
            } catch (FilterException exception) {
                FilterEvaluator.LOG.warn(String.format("subscription %d of %s excluded from %s: %s", subscription.getId(), subscriber, event.getEntity(), exception.getMessage()));
                errors.add(VisibilityError.filter(subscriber, exception.getMessage()));
            }
        }

        return visible;
    }

    /**
     * Tests every filter against the row the change exposes: the new record, or the old record
     * of a delete.
     */
    public boolean matches(ChangeEvent event, List<UserDefinedFilter> filters) throws FilterException {
        Map<String, Object> row = (event.getRecord() != null) ? event.getRecord() : event.getOldRecord();

        if (row == null) {
            throw new FilterException(String.format("%s change carries no record to filter", event.getType()));
        }

        for (UserDefinedFilter filter : filters) {
            if (!this.matches(event, row, filter)) {
                return false;
            }
        }

        return true;
    }

    private boolean matches(ChangeEvent event, Map<String, Object> row, UserDefinedFilter filter) throws FilterException {
        String column = filter.getColumn();
        String declaredType = event.getColumnType(column);

        if (declaredType == null || !row.containsKey(column)) {
            throw new FilterException(String.format("column \"%s\" is not available in the change", column));
        }

        Object value = row.get(column);

        if (value == null) {
            return false;
        }

        return this.comparator.test(declaredType, value, filter.getOperator(), filter.getValue());
    }
}
