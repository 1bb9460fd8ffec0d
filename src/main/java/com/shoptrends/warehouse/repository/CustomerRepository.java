package com.shoptrends.warehouse.repository;

import com.shoptrends.warehouse.entity.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for Dim_Customer rows.
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, Integer> {
}
