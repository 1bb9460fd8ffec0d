package com.shoptrends.warehouse.exception;

/**
 * Base class for errors that fail a whole load run.
 * Batches committed before the failure stay committed.
 */
public class WarehouseLoadException extends RuntimeException {

    public WarehouseLoadException(String message) {
        super(message);
    }

    public WarehouseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
