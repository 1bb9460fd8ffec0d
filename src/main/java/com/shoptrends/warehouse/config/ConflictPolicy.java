package com.shoptrends.warehouse.config;

/**
 * What happens when two records carry different attributes for the same dimension key.
 */
public enum ConflictPolicy {

    /** Fail the run at the extraction stage. */
    FAIL,

    /** Keep the later record's attributes and log a warning. */
    LATER_WINS
}
