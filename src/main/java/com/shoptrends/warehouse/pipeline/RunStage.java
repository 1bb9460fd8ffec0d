package com.shoptrends.warehouse.pipeline;

/**
 * Stages of a load run, in the order a successful run passes through them.
 *
 * <pre>
 *   NOT_STARTED → EXTRACTING → RESOLVING → BUILDING
 *               → LOADING_DIMENSIONS → LOADING_FACTS → COMPLETED
 *   (any stage) → FAILED
 * </pre>
 */
public enum RunStage {
    NOT_STARTED,
    EXTRACTING,
    RESOLVING,
    BUILDING,
    LOADING_DIMENSIONS,
    LOADING_FACTS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
