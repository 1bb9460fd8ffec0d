package com.shoptrends.warehouse.exception;

import com.shoptrends.warehouse.load.StarTable;
import lombok.Getter;

/**
 * Thrown when a batch could not be committed (constraint violation, timeout, lost connection).
 * The batch is rolled back as a whole.
 */
@Getter
public class CommitFailureException extends WarehouseLoadException {

    private final StarTable table;

    public CommitFailureException(StarTable table, int rows, Throwable cause) {
        super("Failed to commit batch of " + rows + " rows into " + table.getTableName()
            + ": " + cause.getMessage(), cause);
        this.table = table;
    }
}
