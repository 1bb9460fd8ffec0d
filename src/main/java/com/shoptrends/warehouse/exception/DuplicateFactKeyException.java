package com.shoptrends.warehouse.exception;

/**
 * Thrown when a purchase transaction id was already used earlier in the same run.
 */
public class DuplicateFactKeyException extends RecordRejectedException {

    public DuplicateFactKeyException(int transactionId) {
        super(RejectionKind.DUPLICATE_FACT_KEY,
            "purchase_transaction_id=" + transactionId,
            "purchase_transaction_id already used in this run: " + transactionId);
    }
}
