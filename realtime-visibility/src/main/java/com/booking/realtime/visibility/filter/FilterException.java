package com.booking.realtime.visibility.filter;

/**
 * A subscriber filter that cannot be evaluated against a change.
 */
public class FilterException extends Exception {

    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
