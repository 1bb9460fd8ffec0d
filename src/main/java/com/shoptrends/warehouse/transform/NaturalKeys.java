package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.entity.ItemKey;
import com.shoptrends.warehouse.source.FlatRecord;

/**
 * Natural keys of the dimension rows a flat record refers to.
 */
final class NaturalKeys {

    static final int NAME_LENGTH = 50;

    private NaturalKeys() {
    }

    static int customerId(FlatRecord record) {
        return FieldCoercion.requiredInteger(record.getCustomerId(), "customer_id",
            describeCustomer(FieldCoercion.text(record.getCustomerId())));
    }

    static ItemKey itemKey(FlatRecord record) {
        String itemName = FieldCoercion.text(record.getItemPurchased());
        String category = FieldCoercion.text(record.getCategory());
        String naturalKey = describeItem(itemName, category);
        return new ItemKey(
            FieldCoercion.requiredText(itemName, "item_name", NAME_LENGTH, naturalKey),
            FieldCoercion.requiredText(category, "category", NAME_LENGTH, naturalKey));
    }

    static String describeCustomer(Object customerId) {
        return "customer_id=" + customerId;
    }

    static String describeItem(ItemKey key) {
        return describeItem(key.getItemName(), key.getCategory());
    }

    static String describeItem(String itemName, String category) {
        return "item=(" + itemName + ", " + category + ")";
    }

    static String describeTransaction(String transactionId) {
        return "purchase_transaction_id=" + FieldCoercion.text(transactionId);
    }
}
