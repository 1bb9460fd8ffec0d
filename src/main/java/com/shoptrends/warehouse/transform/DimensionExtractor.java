package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.config.ConflictPolicy;
import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.entity.Customer;
import com.shoptrends.warehouse.entity.Item;
import com.shoptrends.warehouse.entity.ItemKey;
import com.shoptrends.warehouse.exception.ConsistencyViolationException;
import com.shoptrends.warehouse.exception.RecordRejectedException;
import com.shoptrends.warehouse.exception.RejectionKind;
import com.shoptrends.warehouse.source.FlatRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Derives the Customer and Item dimension rows from the flat records.
 *
 * <p>Single pass over the input with one map per dimension from natural key
 * to entity. The first record seen for a key creates the row; every later
 * record for the same key is compared attribute by attribute, and a
 * disagreement is handled by the configured {@link ConflictPolicy}:
 * <ul>
 *   <li>{@code FAIL}: throws {@link ConsistencyViolationException}</li>
 *   <li>{@code LATER_WINS}: the later attributes replace the row and the
 *       conflict is returned in {@link DimensionExtraction#getConflicts()}</li>
 * </ul>
 *
 * <p>A record only contributes to the dimensions once the whole record is
 * known to become a fact: malformed dimension fields, invalid fact fields and
 * reused transaction ids are rejected here, before the merge, so an excluded
 * record can neither overwrite a row nor raise a conflict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DimensionExtractor {

    private static final int GENDER_LENGTH = 10;
    private static final int LOCATION_LENGTH = 50;
    private static final int SUBSCRIPTION_LENGTH = 10;
    private static final int FREQUENCY_LENGTH = 50;
    private static final int SIZE_LENGTH = 5;
    private static final int COLOR_LENGTH = 20;
    private static final int SEASON_LENGTH = 20;

    private final LoaderProperties properties;

    public DimensionExtraction extract(List<FlatRecord> records) {
        ConflictPolicy policy = properties.getConflictPolicy();
        Map<Integer, Customer> customers = new LinkedHashMap<>();
        Map<ItemKey, Item> items = new LinkedHashMap<>();
        List<FlatRecord> accepted = new ArrayList<>(records.size());
        List<RecordRejection> rejections = new ArrayList<>();
        List<RecordRejection> conflicts = new ArrayList<>();

        FactBuilder screening = FactBuilder.forRun(properties);

        for (FlatRecord record : records) {
            Customer customer;
            Item item;
            try {
                customer = toCustomer(record);
                item = toItem(record);
                screening.build(record, new DimensionReference(customer.getCustomerId(), item.getKey()));
            } catch (RecordRejectedException e) {
                log.debug("Rejected record {}: {}", record.getTransactionId(), e.getMessage());
                rejections.add(RecordRejection.of(record, e));
                continue;
            }

            merge(customers, customer.getCustomerId(), customer,
                NaturalKeys.describeCustomer(customer.getCustomerId()),
                record, policy, conflicts, DimensionExtractor::customerDifferences);
            merge(items, item.getKey(), item,
                NaturalKeys.describeItem(item.getKey()),
                record, policy, conflicts, DimensionExtractor::itemDifferences);
            accepted.add(record);
        }

        log.info("Extracted {} customers and {} items from {} records ({} rejected, {} conflicts)",
            customers.size(), items.size(), records.size(), rejections.size(), conflicts.size());
        return new DimensionExtraction(new DimensionSets(customers, items), accepted, rejections, conflicts);
    }

    private <K, E> void merge(Map<K, E> rows, K key, E candidate, String naturalKey,
                              FlatRecord record, ConflictPolicy policy,
                              List<RecordRejection> conflicts,
                              BiFunction<E, E, List<String>> differ) {
        E existing = rows.putIfAbsent(key, candidate);
        if (existing == null) {
            return;
        }
        List<String> differences = differ.apply(existing, candidate);
        if (differences.isEmpty()) {
            return;
        }

        String detail = String.join(", ", differences);
        if (policy == ConflictPolicy.FAIL) {
            throw new ConsistencyViolationException(naturalKey, detail);
        }
        log.warn("Conflicting attributes for {} in record {}, keeping later values: {}",
            naturalKey, record.getTransactionId(), detail);
        rows.put(key, candidate);
        conflicts.add(RecordRejection.builder()
            .kind(RejectionKind.CONSISTENCY_VIOLATION)
            .naturalKey(naturalKey)
            .transactionId(record.getTransactionId())
            .reason(detail)
            .build());
    }

    private static Customer toCustomer(FlatRecord record) {
        int customerId = NaturalKeys.customerId(record);
        String key = NaturalKeys.describeCustomer(customerId);
        return Customer.builder()
            .customerId(customerId)
            .age(FieldCoercion.optionalNonNegativeInteger(record.getAge(), "age", key))
            .gender(FieldCoercion.optionalText(record.getGender(), "gender", GENDER_LENGTH, key))
            .location(FieldCoercion.optionalText(record.getLocation(), "location", LOCATION_LENGTH, key))
            .subscriptionStatus(FieldCoercion.optionalText(record.getSubscriptionStatus(),
                "subscription_status", SUBSCRIPTION_LENGTH, key))
            .frequencyOfPurchases(FieldCoercion.optionalText(record.getFrequencyOfPurchases(),
                "frequency_of_purchases", FREQUENCY_LENGTH, key))
            .build();
    }

    private static Item toItem(FlatRecord record) {
        ItemKey itemKey = NaturalKeys.itemKey(record);
        String key = NaturalKeys.describeItem(itemKey);
        return Item.builder()
            .itemName(itemKey.getItemName())
            .category(itemKey.getCategory())
            .size(FieldCoercion.optionalText(record.getSize(), "size", SIZE_LENGTH, key))
            .color(FieldCoercion.optionalText(record.getColor(), "color", COLOR_LENGTH, key))
            .season(FieldCoercion.optionalText(record.getSeason(), "season", SEASON_LENGTH, key))
            .build();
    }

    private static List<String> customerDifferences(Customer first, Customer later) {
        List<String> differences = new ArrayList<>();
        compare(differences, "age", first.getAge(), later.getAge());
        compare(differences, "gender", first.getGender(), later.getGender());
        compare(differences, "location", first.getLocation(), later.getLocation());
        compare(differences, "subscription_status", first.getSubscriptionStatus(), later.getSubscriptionStatus());
        compare(differences, "frequency_of_purchases",
            first.getFrequencyOfPurchases(), later.getFrequencyOfPurchases());
        return differences;
    }

    private static List<String> itemDifferences(Item first, Item later) {
        List<String> differences = new ArrayList<>();
        compare(differences, "size", first.getSize(), later.getSize());
        compare(differences, "color", first.getColor(), later.getColor());
        compare(differences, "season", first.getSeason(), later.getSeason());
        return differences;
    }

    private static void compare(List<String> differences, String field, Object first, Object later) {
        if (!Objects.equals(first, later)) {
            differences.add(field + ": " + first + " -> " + later);
        }
    }
}
