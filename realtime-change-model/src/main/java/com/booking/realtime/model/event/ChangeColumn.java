package com.booking.realtime.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A column carried by a change event. The type is the database's declared type name, kept
 * verbatim ({@code int8}, {@code _text}, {@code character varying}, ...).
 */
public final class ChangeColumn implements Serializable {
    private final String name;
    private final String type;

    @JsonCreator
    public ChangeColumn(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        this.name = Objects.requireNonNull(name, "column name");
        this.type = Objects.requireNonNull(type, "column type");
    }

    public String getName() {
        return this.name;
    }

    public String getType() {
        return this.type;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof ChangeColumn)) {
            return false;
        }

        ChangeColumn column = (ChangeColumn) other;

        return this.name.equals(column.name) && this.type.equals(column.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.type);
    }

    @Override
    public String toString() {
        return String.format("%s %s", this.name, this.type);
    }
}
