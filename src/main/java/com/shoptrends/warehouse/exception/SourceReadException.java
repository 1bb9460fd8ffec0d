package com.shoptrends.warehouse.exception;

/**
 * Thrown when the record source fails while it is being read.
 */
public class SourceReadException extends WarehouseLoadException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
