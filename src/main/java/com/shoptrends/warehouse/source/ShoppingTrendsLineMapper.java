package com.shoptrends.warehouse.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Maps CSV lines to {@link FlatRecord}s by header name.
 *
 * <p>Header names are normalized to snake_case before matching, so
 * {@code "Purchase Amount (USD)"} becomes {@code purchase_amount_usd}.
 * When the file has no {@code purchase_transaction_id} column the 0-based
 * data row index is used as the transaction id.
 */
@Slf4j
public class ShoppingTrendsLineMapper implements LineMapper<FlatRecord> {

    static final String TRANSACTION_ID = "purchase_transaction_id";

    private final DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
    private final int headerLines;
    private Set<String> columns = Set.of();

    public ShoppingTrendsLineMapper(int headerLines) {
        this.headerLines = headerLines;
        // short rows are padded so that missing values reach validation
        tokenizer.setStrict(false);
    }

    /**
     * Reads the header line. Must be called before the first {@link #mapLine}.
     */
    public void readHeader(String headerLine) {
        String[] names = tokenizer.tokenize(headerLine).getValues();
        String[] normalized = Arrays.stream(names)
            .map(ShoppingTrendsLineMapper::normalizeColumnName)
            .toArray(String[]::new);
        tokenizer.setNames(normalized);
        columns = new LinkedHashSet<>(Arrays.asList(normalized));
        log.debug("CSV header columns: {}", columns);
    }

    @Override
    public FlatRecord mapLine(String line, int lineNumber) {
        if (columns.isEmpty()) {
            throw new IllegalStateException("CSV header has not been read");
        }
        FieldSet fields = tokenizer.tokenize(line);
        String transactionId = columns.contains(TRANSACTION_ID)
            ? fields.readRawString(TRANSACTION_ID)
            : String.valueOf(lineNumber - headerLines - 1);

        return FlatRecord.builder()
            .transactionId(transactionId)
            .customerId(value(fields, "customer_id"))
            .age(value(fields, "age"))
            .gender(value(fields, "gender"))
            .location(value(fields, "location"))
            .subscriptionStatus(value(fields, "subscription_status"))
            .frequencyOfPurchases(value(fields, "frequency_of_purchases"))
            .itemPurchased(value(fields, "item_purchased"))
            .category(value(fields, "category"))
            .size(value(fields, "size"))
            .color(value(fields, "color"))
            .season(value(fields, "season"))
            .purchaseAmount(value(fields, "purchase_amount_usd"))
            .reviewRating(value(fields, "review_rating"))
            .paymentMethod(value(fields, "payment_method"))
            .shippingType(value(fields, "shipping_type"))
            .discountApplied(value(fields, "discount_applied"))
            .promoCodeUsed(value(fields, "promo_code_used"))
            .previousPurchases(value(fields, "previous_purchases"))
            .preferredPaymentMethod(value(fields, "preferred_payment_method"))
            .build();
    }

    private String value(FieldSet fields, String column) {
        return columns.contains(column) ? fields.readRawString(column) : null;
    }

    static String normalizeColumnName(String header) {
        return header.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_]+", "_")
            .replaceAll("^_+|_+$", "");
    }
}
