package com.shoptrends.warehouse.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the Dim_Customer table.
 * One row per distinct customer identifier.
 */
@Entity
@Table(name = "dim_customer")
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Customer {

    @Id
    @Column(name = "customer_id", nullable = false)
    private Integer customerId;

    @Column(name = "age")
    private Integer age;

    @Column(name = "gender", length = 10)
    private String gender;

    @Column(name = "location", length = 50)
    private String location;

    @Column(name = "subscription_status", length = 10)
    private String subscriptionStatus;

    @Column(name = "frequency_of_purchases", length = 50)
    private String frequencyOfPurchases;
}
