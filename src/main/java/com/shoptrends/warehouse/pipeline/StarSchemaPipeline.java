package com.shoptrends.warehouse.pipeline;

import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.entity.Purchase;
import com.shoptrends.warehouse.exception.RecordRejectedException;
import com.shoptrends.warehouse.exception.SourceReadException;
import com.shoptrends.warehouse.load.LoadOrchestrator;
import com.shoptrends.warehouse.load.StarTable;
import com.shoptrends.warehouse.source.FlatRecord;
import com.shoptrends.warehouse.transform.DimensionExtraction;
import com.shoptrends.warehouse.transform.DimensionExtractor;
import com.shoptrends.warehouse.transform.DimensionReference;
import com.shoptrends.warehouse.transform.DimensionSets;
import com.shoptrends.warehouse.transform.FactBuilder;
import com.shoptrends.warehouse.transform.KeyResolver;
import com.shoptrends.warehouse.transform.RecordRejection;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemReader;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the flat records of one source through extraction, key resolution,
 * fact building and loading, and reports the outcome.
 *
 * <p>Each stage finishes over the whole input before the next one starts.
 * Per-record problems reject that record only; anything else fails the run,
 * and the failure is returned in the {@link RunReport} rather than thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StarSchemaPipeline {

    private final DimensionExtractor dimensionExtractor;
    private final KeyResolver keyResolver;
    private final LoadOrchestrator loadOrchestrator;
    private final LoaderProperties properties;

    public RunReport run(ItemReader<? extends FlatRecord> source) {
        PipelineRun run = new PipelineRun(UUID.randomUUID().toString());
        List<FlatRecord> records = new ArrayList<>();
        List<RecordRejection> rejections = new ArrayList<>();
        List<RecordRejection> conflicts = new ArrayList<>();
        Map<StarTable, Long> storeCounts = new EnumMap<>(StarTable.class);

        try {
            run.advance(RunStage.EXTRACTING);
            readAll(source, records);
            DimensionExtraction extraction = dimensionExtractor.extract(records);
            rejections.addAll(extraction.getRejections());
            conflicts.addAll(extraction.getConflicts());

            run.advance(RunStage.RESOLVING);
            List<Resolved> resolved = resolve(extraction, rejections);

            run.advance(RunStage.BUILDING);
            List<Purchase> facts = build(resolved, rejections);
            DimensionSets referenced = extraction.getDimensions().retainReferencedBy(facts);

            storeCounts.putAll(loadOrchestrator.load(referenced, facts, run));
            run.complete();
        } catch (RuntimeException e) {
            log.error("[RUN {}] failed during {}", run.getRunId(), run.getStageReached(), e);
            run.fail(e);
        }

        RunReport report = report(run, records.size(), rejections, conflicts, storeCounts);
        logSummary(report);
        return report;
    }

    private void readAll(ItemReader<? extends FlatRecord> source, List<FlatRecord> records) {
        try {
            FlatRecord record;
            while ((record = source.read()) != null) {
                records.add(record);
            }
        } catch (Exception e) {
            throw new SourceReadException("Failed to read record " + (records.size() + 1) + ": " + e.getMessage(), e);
        }
        log.info("Read {} flat records", records.size());
    }

    private List<Resolved> resolve(DimensionExtraction extraction, List<RecordRejection> rejections) {
        List<Resolved> resolved = new ArrayList<>(extraction.getAccepted().size());
        for (FlatRecord record : extraction.getAccepted()) {
            try {
                resolved.add(new Resolved(record, keyResolver.resolve(record, extraction.getDimensions())));
            } catch (RecordRejectedException e) {
                reject(record, e, rejections);
            }
        }
        return resolved;
    }

    private List<Purchase> build(List<Resolved> resolved, List<RecordRejection> rejections) {
        FactBuilder factBuilder = FactBuilder.forRun(properties);
        List<Purchase> facts = new ArrayList<>(resolved.size());
        for (Resolved entry : resolved) {
            try {
                facts.add(factBuilder.build(entry.getRecord(), entry.getReference()));
            } catch (RecordRejectedException e) {
                reject(entry.getRecord(), e, rejections);
            }
        }
        return facts;
    }

    private void reject(FlatRecord record, RecordRejectedException e, List<RecordRejection> rejections) {
        log.debug("Rejected record {} ({}): {}", record.getTransactionId(), e.getKind(), e.getMessage());
        rejections.add(RecordRejection.of(record, e));
    }

    private RunReport report(PipelineRun run, int totalRecords, List<RecordRejection> rejections,
                             List<RecordRejection> conflicts, Map<StarTable, Long> storeCounts) {
        Throwable failure = run.getFailure();
        return RunReport.builder()
            .runId(run.getRunId())
            .status(run.getStage())
            .stageReached(run.getStageReached())
            .failureType(failure == null ? null : failure.getClass().getSimpleName())
            .failureMessage(failure == null ? null : failure.getMessage())
            .totalInputRecords(totalRecords)
            .committedCounts(run.getCommitted())
            .storeCounts(storeCounts)
            .rejections(rejections)
            .conflicts(conflicts)
            .startedAt(run.getStartedAt())
            .finishedAt(Instant.now())
            .build();
    }

    private void logSummary(RunReport report) {
        Map<?, Long> byKind = report.getRejections().stream()
            .collect(Collectors.groupingBy(RecordRejection::getKind, Collectors.counting()));
        if (report.isCompleted()) {
            log.info("[RUN {}] completed: input={} facts={} rejected={} {} store={}",
                report.getRunId(), report.getTotalInputRecords(), report.getLoadedFactCount(),
                report.getRejectedCount(), byKind, report.getStoreCounts());
        } else {
            log.info("[RUN {}] failed at {} ({}), committed before failure: {}",
                report.getRunId(), report.getStageReached(), report.getFailureType(),
                report.getCommittedCounts());
        }
    }

    @Value
    private static class Resolved {
        FlatRecord record;
        DimensionReference reference;
    }
}
