package com.shoptrends.warehouse.repository;

import com.shoptrends.warehouse.entity.Item;
import com.shoptrends.warehouse.entity.ItemKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for Dim_Item rows, keyed by (item name, category).
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, ItemKey> {
}
