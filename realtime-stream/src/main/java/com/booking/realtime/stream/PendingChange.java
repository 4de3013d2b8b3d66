package com.booking.realtime.stream;

import com.booking.realtime.commons.checkpoint.StreamPosition;

import java.util.Objects;

/**
 * One change read from the stream but not yet acknowledged: its position and the canonical
 * JSON payload handed to the decoder.
 */
public final class PendingChange {
    private final StreamPosition position;
    private final String data;

    public PendingChange(StreamPosition position, String data) {
        this.position = Objects.requireNonNull(position, "position");
        this.data = Objects.requireNonNull(data, "data");
    }

    public StreamPosition getPosition() {
        return this.position;
    }

    public String getData() {
        return this.data;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        PendingChange change = (PendingChange) other;

        return this.position.equals(change.position) && this.data.equals(change.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.position, this.data);
    }

    @Override
    public String toString() {
        return String.format("%s %s", this.position, this.data);
    }
}
