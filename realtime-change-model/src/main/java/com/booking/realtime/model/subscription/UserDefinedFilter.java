package com.booking.realtime.model.subscription;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single predicate {@code <column> <op> <value>} registered by a subscriber. The value is
 * the literal as text; it is interpreted according to the column's declared type only when
 * the filter is evaluated.
 */
public final class UserDefinedFilter implements Serializable {
    private final String column;
    private final FilterOperator operator;
    private final String value;

    public UserDefinedFilter(String column, FilterOperator operator, String value) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
    }

    public String getColumn() {
        return this.column;
    }

    public FilterOperator getOperator() {
        return this.operator;
    }

    public String getValue() {
        return this.value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof UserDefinedFilter)) {
            return false;
        }

        UserDefinedFilter filter = (UserDefinedFilter) other;

        return this.column.equals(filter.column) && this.operator == filter.operator && Objects.equals(this.value, filter.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.column, this.operator, this.value);
    }

    @Override
    public String toString() {
        return String.format("(%s, %s, %s)", this.column, this.operator, this.value);
    }
}
