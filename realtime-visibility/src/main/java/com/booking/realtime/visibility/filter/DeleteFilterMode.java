package com.booking.realtime.visibility.filter;

/**
 * How subscriber filters apply to deletes.
 */
public enum DeleteFilterMode {
    /**
     * Filters are not applied, every admitted subscriber receives the delete.
     */
    SKIP,
    /**
     * Filters are evaluated against the identity columns of the old record.
     */
    IDENTITY,
    /**
     * Subscribers with filters never receive deletes.
     */
    EXCLUDE
}
