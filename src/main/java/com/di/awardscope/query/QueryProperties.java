package com.di.awardscope.query;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binding for query execution limits.
 *
 * <pre>
 * awardscope:
 *   query:
 *     timeout-ms: 30000
 *     worker-threads: 8
 *     queue-capacity: 64
 *     default-limit: 50
 *     max-page-size: 1000
 *     max-rank-window: 10000
 *     max-raw-window: 10000
 *     default-top-n: 20
 *     max-top-n: 1000
 *     default-bins: 1000
 *     max-bins: 10000
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "awardscope.query")
public class QueryProperties {

    /** Wall-clock budget of search, aggregate and export estimates. */
    @Positive
    private long timeoutMs = 30_000;

    /** Size of the query-worker pool. */
    @Positive
    private int workerThreads = 8;

    /** Requests waiting for a worker beyond this are rejected. */
    @Positive
    private int queueCapacity = 64;

    /** Page size and rank window used when a request names none. */
    @Positive
    private int defaultLimit = 50;

    /** Upper bound of {@code limit}. */
    @Positive
    private int maxPageSize = 1000;

    /** Upper bound of {@code to - from + 1} of a rank range. */
    @Positive
    private int maxRankWindow = 10_000;

    /** Upper bound of {@code offset + limit} for raw fact search (size of the top-K heap). */
    @Positive
    private int maxRawWindow = 10_000;

    /** Entities per dimension in chart aggregates when a request names none. */
    @Positive
    private int defaultTopN = 20;

    @Positive
    private int maxTopN = 1000;

    /** Histogram bins when a request names none. */
    @Positive
    private int defaultBins = 1000;

    @Positive
    private int maxBins = 10_000;
}
