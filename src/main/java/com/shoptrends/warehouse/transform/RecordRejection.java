package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.exception.RecordRejectedException;
import com.shoptrends.warehouse.exception.RejectionKind;
import com.shoptrends.warehouse.source.FlatRecord;
import lombok.Builder;
import lombok.Value;

/**
 * A record excluded from the load, or flagged during extraction, and why.
 */
@Value
@Builder
public class RecordRejection {

    RejectionKind kind;

    /** Natural key the problem was found on, e.g. {@code customer_id=5}. */
    String naturalKey;

    /** Raw transaction id of the offending record. */
    String transactionId;

    String reason;

    public static RecordRejection of(FlatRecord record, RecordRejectedException e) {
        return RecordRejection.builder()
            .kind(e.getKind())
            .naturalKey(e.getNaturalKey())
            .transactionId(record.getTransactionId())
            .reason(e.getMessage())
            .build();
    }
}
