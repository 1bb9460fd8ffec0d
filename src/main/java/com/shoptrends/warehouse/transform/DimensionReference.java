package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.entity.ItemKey;
import lombok.Value;

/**
 * The validated foreign keys a fact row carries.
 */
@Value
public class DimensionReference {

    int customerId;

    ItemKey itemKey;
}
