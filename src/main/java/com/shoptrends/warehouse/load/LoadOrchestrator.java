package com.shoptrends.warehouse.load;

import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.entity.Purchase;
import com.shoptrends.warehouse.exception.LoadVerificationException;
import com.shoptrends.warehouse.transform.DimensionSets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one run's star schema into the {@link RelationalStore}.
 *
 * <pre>
 *   1. createSchemaIfAbsent
 *   2. Dim_Customer, Dim_Item   upsert, batch by batch
 *   3. Fact_Purchase            upsert, batch by batch
 *   4. rowCount per table must equal the rows committed in steps 2-3,
 *      and no fact may point at a missing dimension row
 * </pre>
 *
 * <p>No fact batch is issued before every dimension batch has committed,
 * which is what lets the foreign keys hold on a cold load without deferred
 * constraints. Facts are upserted on {@code purchase_transaction_id}; the
 * table is never truncated. A failure leaves the batches committed so far in
 * place and a re-run overwrites them with identical rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadOrchestrator {

    private final RelationalStore store;
    private final LoaderProperties properties;

    /**
     * @return row counts reported by the store after the load
     */
    public Map<StarTable, Long> load(DimensionSets dimensions, List<Purchase> facts, LoadProgress progress) {
        progress.loadingDimensions();
        store.createSchemaIfAbsent();

        Map<StarTable, Long> committed = new EnumMap<>(StarTable.class);
        committed.put(StarTable.CUSTOMER,
            writeInBatches(StarTable.CUSTOMER, new ArrayList<>(dimensions.customers()), progress));
        committed.put(StarTable.ITEM,
            writeInBatches(StarTable.ITEM, new ArrayList<>(dimensions.items()), progress));

        progress.loadingFacts();
        committed.put(StarTable.PURCHASE, writeInBatches(StarTable.PURCHASE, facts, progress));

        return verify(committed);
    }

    private long writeInBatches(StarTable table, List<?> rows, LoadProgress progress) {
        int batchSize = properties.getBatchSize();
        int batches = 0;
        long written = 0;
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<?> batch = rows.subList(from, Math.min(from + batchSize, rows.size()));
            int count = store.upsertRows(table, batch);
            progress.batchCommitted(table, count);
            written += count;
            batches++;
        }
        log.info("Loaded {} rows into {} in {} batches", written, table.getTableName(), batches);
        return written;
    }

    private Map<StarTable, Long> verify(Map<StarTable, Long> committed) {
        Map<StarTable, Long> stored = new EnumMap<>(StarTable.class);
        for (Map.Entry<StarTable, Long> entry : committed.entrySet()) {
            long count = store.rowCount(entry.getKey());
            if (count != entry.getValue()) {
                throw new LoadVerificationException(entry.getKey(), entry.getValue(), count);
            }
            stored.put(entry.getKey(), count);
        }
        long orphans = store.orphanedFactCount();
        if (orphans != 0) {
            throw new LoadVerificationException(orphans);
        }
        return Collections.unmodifiableMap(stored);
    }
}
