package com.booking.realtime.visibility;

/**
 * How row level security treats deletes, whose old record carries identity columns only.
 */
public enum DeleteAdmission {
    /**
     * Ask the admission primitive with the identity columns. Policies that depend on other
     * columns will not admit the row.
     */
    EVALUATE,
    /**
     * Every subscriber of the entity receives deletes.
     */
    ADMIT_ALL
}
