package com.shoptrends.warehouse.exception;

import com.shoptrends.warehouse.load.StarTable;

/**
 * Thrown when the rows committed by a run do not match what the store reports afterwards.
 */
public class LoadVerificationException extends WarehouseLoadException {

    public LoadVerificationException(StarTable table, long committed, long stored) {
        super(table.getTableName() + ": committed " + committed + " rows but store reports " + stored);
    }

    public LoadVerificationException(long orphanedFacts) {
        super("Fact_Purchase has " + orphanedFacts + " rows without a matching dimension row");
    }
}
