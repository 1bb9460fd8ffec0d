package com.shoptrends.warehouse.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * JPA Entity for the Fact_Purchase table.
 * Represents one purchase transaction, referencing its customer and item by natural key.
 */
@Entity
@Table(name = "fact_purchase", indexes = {
    @Index(name = "idx_fact_purchase_customer", columnList = "customer_id"),
    @Index(name = "idx_fact_purchase_item", columnList = "item_name, category")
})
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Purchase {

    @Id
    @Column(name = "purchase_transaction_id", nullable = false)
    private Integer purchaseTransactionId;

    @Column(name = "customer_id", nullable = false)
    private Integer customerId;

    @Column(name = "item_name", nullable = false, length = 50)
    private String itemName;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "purchase_amount_usd", precision = 10, scale = 2)
    private BigDecimal purchaseAmountUsd;

    @Column(name = "review_rating", precision = 3, scale = 2)
    private BigDecimal reviewRating;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "shipping_type", length = 50)
    private String shippingType;

    @Column(name = "discount_applied", length = 5)
    private String discountApplied;

    @Column(name = "promo_code_used", length = 5)
    private String promoCodeUsed;

    @Column(name = "previous_purchases")
    private Integer previousPurchases;

    @Column(name = "preferred_payment_method", length = 50)
    private String preferredPaymentMethod;

    public ItemKey getItemKey() {
        return new ItemKey(itemName, category);
    }
}
