package com.booking.realtime.decoder;

/**
 * Raised when a change payload does not have the exact shape its kind requires. The payload
 * must not be skipped silently: the stream stays at the failing change.
 */
public class DecodeException extends Exception {

    public enum Reason {
        MALFORMED_PAYLOAD,
        UNKNOWN_KIND,
        UNEXPECTED_FIELD,
        MISSING_FIELD,
        MALFORMED_FIELD
    }

    private final Reason reason;
    private final String field;

    public DecodeException(Reason reason, String field, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.field = field;
    }

    public DecodeException(Reason reason, String field, String message) {
        this(reason, field, message, null);
    }

    public Reason getReason() {
        return this.reason;
    }

    /**
     * Name of the offending field, {@code null} for payload level failures.
     */
    public String getField() {
        return this.field;
    }
}
