package com.shoptrends.warehouse.pipeline;

import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.exception.WarehouseLoadException;
import com.shoptrends.warehouse.load.StarTable;
import com.shoptrends.warehouse.source.FlatRecord;
import com.shoptrends.warehouse.source.ShoppingTrendsReaderFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Batch step body: one {@link StarSchemaPipeline} run over the CSV named by
 * the {@code input.path} job parameter, or {@code warehouse.load.input-path}.
 * A failed run fails the step, and with it the job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StarSchemaLoadTasklet implements Tasklet {

    public static final String INPUT_PATH_PARAMETER = "input.path";

    private final StarSchemaPipeline pipeline;
    private final ShoppingTrendsReaderFactory readerFactory;
    private final LoaderProperties properties;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        String inputPath = inputPath(chunkContext.getStepContext().getJobParameters());
        log.info("Loading star schema from {}", inputPath);

        FlatFileItemReader<FlatRecord> reader = readerFactory.create(new FileSystemResource(inputPath));
        RunReport report;
        reader.open(new ExecutionContext());
        try {
            report = pipeline.run(reader);
        } finally {
            reader.close();
        }

        ExecutionContext stepContext = chunkContext.getStepContext().getStepExecution().getExecutionContext();
        stepContext.putString("run.id", report.getRunId());
        stepContext.putString("run.status", report.getStatus().name());
        stepContext.putLong("records.total", report.getTotalInputRecords());
        stepContext.putLong("records.rejected", report.getRejectedCount());
        for (StarTable table : StarTable.values()) {
            stepContext.putLong("committed." + table.getTableName(),
                report.getCommittedCounts().getOrDefault(table, 0L));
        }
        contribution.incrementWriteCount(report.getLoadedFactCount());
        contribution.incrementFilterCount(report.getRejectedCount());

        if (!report.isCompleted()) {
            throw new WarehouseLoadException("Run " + report.getRunId() + " failed at "
                + report.getStageReached() + ": " + report.getFailureMessage());
        }
        return RepeatStatus.FINISHED;
    }

    private String inputPath(Map<String, Object> jobParameters) {
        Object parameter = jobParameters.get(INPUT_PATH_PARAMETER);
        return parameter != null ? parameter.toString() : properties.getInputPath();
    }
}
