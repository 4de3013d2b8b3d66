package com.booking.realtime.commons.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Position of a single change in the change stream.
 *
 * The log sequence number orders changes by commit position; several changes may share one
 * LSN, in which case the ordinal (0-based, in stream order) breaks the tie. The text form is
 * {@code <hi>/<lo>#<ordinal>} with hexadecimal halves, as PostgreSQL prints LSNs.
 */
public final class StreamPosition implements Serializable, Comparable<StreamPosition> {

    public static final StreamPosition START = new StreamPosition(0L, 0);

    private final long lsn;
    private final int ordinal;

    @JsonCreator
    public StreamPosition(@JsonProperty("lsn") long lsn, @JsonProperty("ordinal") int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException(String.format("negative ordinal: %d", ordinal));
        }

        this.lsn = lsn;
        this.ordinal = ordinal;
    }

    public long getLsn() {
        return this.lsn;
    }

    public int getOrdinal() {
        return this.ordinal;
    }

    @JsonIgnore
    public String getLsnText() {
        return StreamPosition.formatLsn(this.lsn);
    }

    public static StreamPosition of(String lsnText, int ordinal) {
        return new StreamPosition(StreamPosition.parseLsn(lsnText), ordinal);
    }

    public static StreamPosition parse(String text) {
        Objects.requireNonNull(text, "position text");

        int separator = text.indexOf('#');

        if (separator < 0) {
            return StreamPosition.of(text, 0);
        }

        try {
            return StreamPosition.of(text.substring(0, separator), Integer.parseInt(text.substring(separator + 1)));
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(String.format("invalid stream position: %s", text), exception);
        }
    }

    public static long parseLsn(String lsnText) {
        Objects.requireNonNull(lsnText, "lsn text");

        int slash = lsnText.indexOf('/');

        if (slash <= 0 || slash == lsnText.length() - 1) {
            throw new IllegalArgumentException(String.format("invalid lsn: %s", lsnText));
        }

        try {
            long hi = Long.parseLong(lsnText.substring(0, slash), 16);
            long lo = Long.parseLong(lsnText.substring(slash + 1), 16);

            if (hi > 0xFFFFFFFFL || lo > 0xFFFFFFFFL) {
                throw new IllegalArgumentException(String.format("invalid lsn: %s", lsnText));
            }

            return (hi << 32) | lo;
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(String.format("invalid lsn: %s", lsnText), exception);
        }
    }

    public static String formatLsn(long lsn) {
        return String.format("%X/%X", lsn >>> 32, lsn & 0xFFFFFFFFL);
    }

    @Override
    public int compareTo(StreamPosition position) {
        if (position == null) {
            return 1;
        }

        int comparison = Long.compareUnsigned(this.lsn, position.lsn);

        if (comparison == 0) {
            comparison = Integer.compare(this.ordinal, position.ordinal);
        }

        return comparison;
    }

    public boolean isAfter(StreamPosition position) {
        return this.compareTo(position) > 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof StreamPosition)) {
            return false;
        }

        StreamPosition position = (StreamPosition) other;

        return this.lsn == position.lsn && this.ordinal == position.ordinal;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.lsn, this.ordinal);
    }

    @Override
    public String toString() {
        return String.format("%s#%d", this.getLsnText(), this.ordinal);
    }
}
