package com.shoptrends.warehouse.config;

import com.shoptrends.warehouse.pipeline.StarSchemaLoadTasklet;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Batch wiring for the star schema load.
 *
 * The step runs under a resourceless transaction manager: the load commits
 * its own batches and must not be wrapped in one step-wide transaction.
 */
@Configuration
public class StarSchemaJobConfiguration {

    public static final String JOB_NAME = "starSchemaLoadJob";

    @Bean
    public Job starSchemaLoadJob(JobRepository jobRepository, Step loadStarSchemaStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(loadStarSchemaStep)
            .build();
    }

    @Bean
    public Step loadStarSchemaStep(JobRepository jobRepository, StarSchemaLoadTasklet tasklet) {
        return new StepBuilder("loadStarSchemaStep", jobRepository)
            .tasklet(tasklet, new ResourcelessTransactionManager())
            .build();
    }
}
