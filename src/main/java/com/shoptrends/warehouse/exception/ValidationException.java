package com.shoptrends.warehouse.exception;

/**
 * Thrown when a field of a flat record is missing, malformed or out of range.
 */
public class ValidationException extends RecordRejectedException {

    public ValidationException(String naturalKey, String reason) {
        super(RejectionKind.VALIDATION_ERROR, naturalKey, reason);
    }
}
