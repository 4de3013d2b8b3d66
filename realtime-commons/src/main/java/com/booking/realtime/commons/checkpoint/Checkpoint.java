package com.booking.realtime.commons.checkpoint;

import java.io.Serializable;
import java.util.Objects;

@SuppressWarnings("unused")
public class Checkpoint implements Serializable, Comparable<Checkpoint> {
    private StreamPosition position;
    private long timestamp;

    public Checkpoint() {
    }

    public Checkpoint(StreamPosition position, long timestamp) {
        this.position = position;
        this.timestamp = timestamp;
    }

    public StreamPosition getPosition() {
        return this.position;
    }

    public void setPosition(StreamPosition position) {
        this.position = position;
    }

    public long getTimestamp() {
        return this.timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public int compareTo(Checkpoint checkpoint) {
        if (checkpoint == null) {
            return 1;
        }

        if (this.position != null && checkpoint.position != null) {
            return this.position.compareTo(checkpoint.position);
        } else if (this.position != null) {
            return 1;
        } else if (checkpoint.position != null) {
            return -1;
        } else {
            return 0;
        }
    }

    @Override
    public boolean equals(Object checkpoint) {
        if (checkpoint instanceof Checkpoint) {
            return this.compareTo((Checkpoint) checkpoint) == 0;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.position);
    }

    @Override
    public String toString() {
        return String.format("position: %s | timestamp: %s", this.position, this.timestamp);
    }
}
