package com.shoptrends.warehouse.exception;

import lombok.Getter;

/**
 * Thrown when two records disagree on the attributes of one dimension key
 * and the conflict policy is {@code FAIL}.
 */
@Getter
public class ConsistencyViolationException extends WarehouseLoadException {

    private final String naturalKey;

    public ConsistencyViolationException(String naturalKey, String differences) {
        super("Conflicting attributes for " + naturalKey + ": " + differences);
        this.naturalKey = naturalKey;
    }
}
