package com.shoptrends.warehouse.repository;

import com.shoptrends.warehouse.entity.Purchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repository for Fact_Purchase rows.
 * Also answers the orphaned-fact check run after a load.
 */
@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, Integer> {

    /**
     * Count fact rows whose customer_id has no Dim_Customer row
     */
    @Query("SELECT COUNT(p) FROM Purchase p WHERE NOT EXISTS "
        + "(SELECT c FROM Customer c WHERE c.customerId = p.customerId)")
    long countWithoutCustomer();

    /**
     * Count fact rows whose (item_name, category) has no Dim_Item row
     */
    @Query("SELECT COUNT(p) FROM Purchase p WHERE NOT EXISTS "
        + "(SELECT i FROM Item i WHERE i.itemName = p.itemName AND i.category = p.category)")
    long countWithoutItem();
}
