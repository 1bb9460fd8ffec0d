package com.shoptrends.warehouse.load;

/**
 * Callbacks fired by {@link LoadOrchestrator} as a load advances.
 */
public interface LoadProgress {

    void loadingDimensions();

    void loadingFacts();

    void batchCommitted(StarTable table, int rows);
}
