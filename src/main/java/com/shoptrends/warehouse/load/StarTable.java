package com.shoptrends.warehouse.load;

import com.shoptrends.warehouse.entity.Customer;
import com.shoptrends.warehouse.entity.Item;
import com.shoptrends.warehouse.entity.Purchase;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three tables of the star schema, in load order.
 */
@Getter
@RequiredArgsConstructor
public enum StarTable {

    CUSTOMER("Dim_Customer", Customer.class),
    ITEM("Dim_Item", Item.class),
    PURCHASE("Fact_Purchase", Purchase.class);

    private final String tableName;
    private final Class<?> rowType;
}
