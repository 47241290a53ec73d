package com.di.awardscope.export;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binding for export batching and size estimation.
 *
 * <pre>
 * awardscope:
 *   export:
 *     batch-size: 50000
 *     raw-row-bytes: 250
 *     aggregated-row-bytes: 120
 *     job-retention-seconds: 300
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "awardscope.export")
public class ExportProperties {

    /** Rows per batch; cancellation and progress are checked between batches. */
    @Positive
    private int batchSize = 50_000;

    /** Average width of a raw fact row, used by the byte estimate. */
    @Positive
    private int rawRowBytes = 250;

    /** Average width of an aggregated row, used by the byte estimate. */
    @Positive
    private int aggregatedRowBytes = 120;

    /** How long finished jobs stay visible to {@code GET /api/contracts/exports/{id}}. */
    @PositiveOrZero
    private long jobRetentionSeconds = 300;
}
