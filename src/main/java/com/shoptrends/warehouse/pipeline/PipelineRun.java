package com.shoptrends.warehouse.pipeline;

import com.shoptrends.warehouse.load.LoadProgress;
import com.shoptrends.warehouse.load.StarTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * State of one load run. Stages only move forward one step at a time;
 * {@link #fail} is allowed from any stage that is not terminal.
 */
@Slf4j
@Getter
public class PipelineRun implements LoadProgress {

    private final String runId;
    private final Instant startedAt = Instant.now();
    private RunStage stage = RunStage.NOT_STARTED;

    /** Last stage entered before the run failed; equals {@link #stage} otherwise. */
    private RunStage stageReached = RunStage.NOT_STARTED;
    private Throwable failure;
    private final Map<StarTable, Long> committed = new EnumMap<>(StarTable.class);

    public PipelineRun(String runId) {
        this.runId = runId;
    }

    public void advance(RunStage next) {
        if (stage.isTerminal() || next == RunStage.FAILED || next.ordinal() != stage.ordinal() + 1) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + stage + " to " + next);
        }
        log.info("[RUN {}] {} -> {}", runId, stage, next);
        stage = next;
        stageReached = next;
    }

    public void complete() {
        advance(RunStage.COMPLETED);
    }

    public void fail(Throwable cause) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already " + stage, cause);
        }
        log.info("[RUN {}] {} -> {}", runId, stage, RunStage.FAILED);
        failure = cause;
        stage = RunStage.FAILED;
    }

    public Map<StarTable, Long> getCommitted() {
        return Collections.unmodifiableMap(committed);
    }

    @Override
    public void loadingDimensions() {
        advance(RunStage.LOADING_DIMENSIONS);
    }

    @Override
    public void loadingFacts() {
        advance(RunStage.LOADING_FACTS);
    }

    @Override
    public void batchCommitted(StarTable table, int rows) {
        committed.merge(table, (long) rows, Long::sum);
    }
}
