package com.event.seating.engine;

/**
 * How many tables a MUST_NOT_SIT_TOGETHER check reports per constraint.
 */
public enum ViolationReporting {
    FIRST_MATCH, // stop at the first shared table (search gate)
    ALL_TABLES
}
