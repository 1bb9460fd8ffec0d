package com.shoptrends.warehouse.pipeline;

import com.shoptrends.warehouse.load.StarTable;
import com.shoptrends.warehouse.transform.RecordRejection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one load run.
 *
 * <p>A completed run satisfies
 * {@code getRejectedCount() + getLoadedFactCount() == getTotalInputRecords()}.
 */
@Value
@Builder
public class RunReport {

    String runId;

    /** {@link RunStage#COMPLETED} or {@link RunStage#FAILED}. */
    RunStage status;

    /** Last stage the run entered. */
    RunStage stageReached;

    String failureType;
    String failureMessage;

    long totalInputRecords;

    /** Rows committed by this run per table, including partial progress of a failed run. */
    @Singular
    Map<StarTable, Long> committedCounts;

    /** Rows the store reported after the load; empty unless the run completed. */
    @Singular
    Map<StarTable, Long> storeCounts;

    @Singular
    List<RecordRejection> rejections;

    /** Consistency violations that were resolved by keeping the later values. */
    @Singular
    List<RecordRejection> conflicts;

    Instant startedAt;
    Instant finishedAt;

    public boolean isCompleted() {
        return status == RunStage.COMPLETED;
    }

    public long getRejectedCount() {
        return rejections.size();
    }

    public long getLoadedFactCount() {
        return committedCounts.getOrDefault(StarTable.PURCHASE, 0L);
    }
}
