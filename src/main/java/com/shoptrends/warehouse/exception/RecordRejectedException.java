package com.shoptrends.warehouse.exception;

import lombok.Getter;

/**
 * Thrown when a single flat record cannot become a fact row.
 * The record is excluded and reported; the run continues.
 */
@Getter
public abstract class RecordRejectedException extends RuntimeException {

    private final RejectionKind kind;

    /** Natural key of the offending record, e.g. {@code customer_id=17}. */
    private final String naturalKey;

    protected RecordRejectedException(RejectionKind kind, String naturalKey, String reason) {
        super(reason);
        this.kind = kind;
        this.naturalKey = naturalKey;
    }
}
