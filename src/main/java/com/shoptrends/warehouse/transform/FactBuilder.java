package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.entity.Purchase;
import com.shoptrends.warehouse.exception.DuplicateFactKeyException;
import com.shoptrends.warehouse.exception.ValidationException;
import com.shoptrends.warehouse.source.FlatRecord;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns a flat record and its resolved keys into a Fact_Purchase row.
 *
 * <p>One instance per pass over the input: it remembers the transaction ids already built
 * and rejects later records reusing one. A record only claims its id once
 * every other field has passed validation.
 */
public class FactBuilder {

    /** Digits before the point in DECIMAL(10,2) and DECIMAL(3,2). */
    private static final int AMOUNT_INTEGER_DIGITS = 8;
    private static final int RATING_INTEGER_DIGITS = 1;

    private static final int TEXT_LENGTH = 50;

    private final BigDecimal minRating;
    private final BigDecimal maxRating;
    private final Set<Integer> transactionIds = new HashSet<>();

    public FactBuilder(BigDecimal minRating, BigDecimal maxRating) {
        if (minRating.compareTo(maxRating) > 0) {
            throw new IllegalArgumentException(
                "Review rating range is empty: " + minRating + " > " + maxRating);
        }
        this.minRating = minRating;
        this.maxRating = maxRating;
    }

    public static FactBuilder forRun(LoaderProperties properties) {
        return new FactBuilder(properties.getMinReviewRating(), properties.getMaxReviewRating());
    }

    public Purchase build(FlatRecord record, DimensionReference reference) {
        String key = NaturalKeys.describeTransaction(record.getTransactionId());
        int transactionId = FieldCoercion.requiredInteger(record.getTransactionId(), "purchase_transaction_id", key);

        BigDecimal amount = FieldCoercion.requiredDecimal2(record.getPurchaseAmount(), "purchase_amount_usd",
            AMOUNT_INTEGER_DIGITS, key);
        if (amount.signum() < 0) {
            throw new ValidationException(key, "purchase_amount_usd must not be negative: " + amount);
        }

        BigDecimal rating = FieldCoercion.requiredDecimal2(record.getReviewRating(), "review_rating",
            RATING_INTEGER_DIGITS, key);
        if (rating.compareTo(minRating) < 0 || rating.compareTo(maxRating) > 0) {
            throw new ValidationException(key,
                "review_rating " + rating + " outside [" + minRating + ", " + maxRating + "]");
        }

        Purchase purchase = Purchase.builder()
            .purchaseTransactionId(transactionId)
            .customerId(reference.getCustomerId())
            .itemName(reference.getItemKey().getItemName())
            .category(reference.getItemKey().getCategory())
            .purchaseAmountUsd(amount)
            .reviewRating(rating)
            .paymentMethod(FieldCoercion.optionalText(record.getPaymentMethod(), "payment_method", TEXT_LENGTH, key))
            .shippingType(FieldCoercion.optionalText(record.getShippingType(), "shipping_type", TEXT_LENGTH, key))
            .discountApplied(FieldCoercion.yesNo(record.getDiscountApplied(), "discount_applied", key))
            .promoCodeUsed(FieldCoercion.yesNo(record.getPromoCodeUsed(), "promo_code_used", key))
            .previousPurchases(FieldCoercion.nonNegativeInteger(record.getPreviousPurchases(), "previous_purchases", key))
            .preferredPaymentMethod(FieldCoercion.optionalText(record.getPreferredPaymentMethod(),
                "preferred_payment_method", TEXT_LENGTH, key))
            .build();

        if (!transactionIds.add(transactionId)) {
            throw new DuplicateFactKeyException(transactionId);
        }
        return purchase;
    }
}
