package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.entity.Customer;
import com.shoptrends.warehouse.entity.Item;
import com.shoptrends.warehouse.entity.ItemKey;
import com.shoptrends.warehouse.entity.Purchase;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deduplicated Customer and Item rows, each keyed by natural key.
 * Iteration follows first-seen order.
 */
public final class DimensionSets {

    private final Map<Integer, Customer> customers;
    private final Map<ItemKey, Item> items;

    public DimensionSets(Map<Integer, Customer> customers, Map<ItemKey, Item> items) {
        this.customers = Collections.unmodifiableMap(new LinkedHashMap<>(customers));
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public Optional<Customer> findCustomer(int customerId) {
        return Optional.ofNullable(customers.get(customerId));
    }

    public Optional<Item> findItem(ItemKey key) {
        return Optional.ofNullable(items.get(key));
    }

    public Collection<Customer> customers() {
        return customers.values();
    }

    public Collection<Item> items() {
        return items.values();
    }

    /**
     * Drops the rows no fact references.
     */
    public DimensionSets retainReferencedBy(Collection<Purchase> facts) {
        Set<Integer> customerIds = facts.stream()
            .map(Purchase::getCustomerId)
            .collect(Collectors.toSet());
        Set<ItemKey> itemKeys = facts.stream()
            .map(Purchase::getItemKey)
            .collect(Collectors.toSet());

        Map<Integer, Customer> keptCustomers = new LinkedHashMap<>(customers);
        keptCustomers.keySet().retainAll(customerIds);
        Map<ItemKey, Item> keptItems = new LinkedHashMap<>(items);
        keptItems.keySet().retainAll(itemKeys);
        return new DimensionSets(keptCustomers, keptItems);
    }
}
