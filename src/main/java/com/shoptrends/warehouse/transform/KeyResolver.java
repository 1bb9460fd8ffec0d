package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.entity.ItemKey;
import com.shoptrends.warehouse.exception.MissingDimensionReferenceException;
import com.shoptrends.warehouse.exception.ValidationException;
import com.shoptrends.warehouse.source.FlatRecord;
import org.springframework.stereotype.Component;

/**
 * Resolves the customer and item a flat record refers to against the extracted dimensions.
 */
@Component
public class KeyResolver {

    /**
     * @throws MissingDimensionReferenceException when either key cannot be computed
     *         or has no row in {@code dimensions}
     */
    public DimensionReference resolve(FlatRecord record, DimensionSets dimensions) {
        int customerId;
        ItemKey itemKey;
        try {
            customerId = NaturalKeys.customerId(record);
            itemKey = NaturalKeys.itemKey(record);
        } catch (ValidationException e) {
            throw new MissingDimensionReferenceException(e.getNaturalKey(),
                "Dimension key cannot be resolved: " + e.getMessage());
        }

        if (dimensions.findCustomer(customerId).isEmpty()) {
            throw new MissingDimensionReferenceException(NaturalKeys.describeCustomer(customerId),
                "No Dim_Customer row for customer_id " + customerId);
        }
        if (dimensions.findItem(itemKey).isEmpty()) {
            throw new MissingDimensionReferenceException(NaturalKeys.describeItem(itemKey),
                "No Dim_Item row for " + itemKey);
        }
        return new DimensionReference(customerId, itemKey);
    }
}
