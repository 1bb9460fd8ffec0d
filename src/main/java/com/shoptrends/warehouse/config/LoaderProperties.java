package com.shoptrends.warehouse.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Load settings bound from {@code warehouse.load.*} in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "warehouse.load")
public class LoaderProperties {

    /** CSV file read by the batch job when no {@code input.path} job parameter is given. */
    @NotBlank
    private String inputPath = "/app/data/shopping_trends.csv";

    /** Rows per committed batch. */
    @Min(1)
    @Max(10_000)
    private int batchSize = 500;

    /** Upper bound for a single batch transaction, commit included. */
    @NotNull
    private Duration commitTimeout = Duration.ofSeconds(30);

    @NotNull
    private ConflictPolicy conflictPolicy = ConflictPolicy.LATER_WINS;

    /** Lowest accepted review rating, inclusive. */
    @NotNull
    @DecimalMin("0.00")
    @DecimalMax("9.99")
    private BigDecimal minReviewRating = new BigDecimal("0.00");

    /** Highest accepted review rating, inclusive. Must fit DECIMAL(3,2). */
    @NotNull
    @DecimalMin("0.00")
    @DecimalMax("9.99")
    private BigDecimal maxReviewRating = new BigDecimal("5.00");
}
