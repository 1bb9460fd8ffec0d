package com.shoptrends.warehouse.source;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the flat shopping trends dataset, exactly as read.
 *
 * <p>Every field holds raw text; parsing and range checks happen in the
 * transform stage so that a bad value rejects one record instead of
 * aborting the read.
 */
@Value
@Builder(toBuilder = true)
public class FlatRecord {

    String transactionId;

    String customerId;
    String age;
    String gender;
    String location;
    String subscriptionStatus;
    String frequencyOfPurchases;

    String itemPurchased;
    String category;
    String size;
    String color;
    String season;

    String purchaseAmount;
    String reviewRating;
    String paymentMethod;
    String shippingType;
    String discountApplied;
    String promoCodeUsed;
    String previousPurchases;
    String preferredPaymentMethod;
}
