package com.shoptrends.warehouse.load;

import com.shoptrends.warehouse.exception.CommitFailureException;
import com.shoptrends.warehouse.exception.StoreUnavailableException;

import java.util.List;

/**
 * The warehouse database as seen by the loader.
 */
public interface RelationalStore {

    /**
     * Creates Dim_Customer, Dim_Item and Fact_Purchase unless they already exist.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     */
    void createSchemaIfAbsent();

    /**
     * Inserts the rows, or overwrites the rows already stored under the same
     * primary key, in a single transaction.
     *
     * @param rows entities of {@link StarTable#getRowType()}
     * @return number of rows written
     * @throws CommitFailureException if the transaction did not commit; none of the rows are stored
     * @throws StoreUnavailableException if the store cannot be reached
     */
    int upsertRows(StarTable table, List<?> rows);

    long rowCount(StarTable table);

    /**
     * Counts Fact_Purchase rows whose customer or item has no dimension row.
     */
    long orphanedFactCount();
}
