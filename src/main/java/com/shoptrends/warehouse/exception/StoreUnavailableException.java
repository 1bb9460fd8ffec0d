package com.shoptrends.warehouse.exception;

/**
 * Thrown when the relational store cannot be reached within the connection timeout.
 */
public class StoreUnavailableException extends WarehouseLoadException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
