package com.shoptrends.warehouse.exception;

/**
 * Thrown when a record references a customer or item absent from the extracted dimensions.
 */
public class MissingDimensionReferenceException extends RecordRejectedException {

    public MissingDimensionReferenceException(String naturalKey, String reason) {
        super(RejectionKind.MISSING_DIMENSION_REFERENCE, naturalKey, reason);
    }
}
