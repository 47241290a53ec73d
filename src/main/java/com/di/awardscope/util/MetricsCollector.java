package com.di.awardscope.util;

import com.di.awardscope.planner.PlanKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for query planning, aggregation and export operations.
 * Exposed through Spring Boot Actuator ({@code /actuator/metrics}).
 */
@Slf4j
@Component
public class MetricsCollector {

    // Planner Metrics
    private final Map<PlanKind, Counter> planCounters = new EnumMap<>(PlanKind.class);
    private final Counter degradedPlanCounter;

    // Query Metrics
    private final Timer queryTimer;
    private final Counter queryErrorCounter;
    private final Counter queryTimeoutCounter;
    private final DistributionSummary scannedRowsDistribution;

    // Export Metrics
    private final Counter exportRowsCounter;
    private final Counter exportCompletedCounter;
    private final Counter exportCancelledCounter;
    private final Counter exportFailedCounter;

    // Snapshot Metrics
    private final Counter snapshotActivationCounter;
    private final Counter inconsistencyCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        for (PlanKind kind : PlanKind.values()) {
            planCounters.put(kind, Counter.builder("awardscope.plan.total")
                    .description("Query plans chosen, by plan kind")
                    .tag("kind", kind.name())
                    .register(meterRegistry));
        }

        this.degradedPlanCounter = Counter.builder("awardscope.plan.degraded")
                .description("Plans that fell back to a fact scan because a rollup was missing")
                .register(meterRegistry);

        this.queryTimer = Timer.builder("awardscope.query.duration")
                .description("Time taken to answer search, aggregate and estimate requests")
                .register(meterRegistry);

        this.queryErrorCounter = Counter.builder("awardscope.query.errors")
                .description("Queries that failed with an exception")
                .register(meterRegistry);

        this.queryTimeoutCounter = Counter.builder("awardscope.query.timeouts")
                .description("Queries aborted after exceeding the wall-clock budget")
                .register(meterRegistry);

        this.scannedRowsDistribution = DistributionSummary.builder("awardscope.scan.rows")
                .description("Fact rows read per scan")
                .baseUnit("rows")
                .register(meterRegistry);

        this.exportRowsCounter = Counter.builder("awardscope.export.rows")
                .description("Rows written by exports")
                .baseUnit("rows")
                .register(meterRegistry);

        this.exportCompletedCounter = Counter.builder("awardscope.export.total")
                .description("Exports by outcome")
                .tag("status", "completed")
                .register(meterRegistry);

        this.exportCancelledCounter = Counter.builder("awardscope.export.total")
                .description("Exports by outcome")
                .tag("status", "cancelled")
                .register(meterRegistry);

        this.exportFailedCounter = Counter.builder("awardscope.export.total")
                .description("Exports by outcome")
                .tag("status", "failed")
                .register(meterRegistry);

        this.snapshotActivationCounter = Counter.builder("awardscope.snapshot.activations")
                .description("Snapshot versions activated")
                .register(meterRegistry);

        this.inconsistencyCounter = Counter.builder("awardscope.snapshot.inconsistencies")
                .description("Rollup tables rejected by integrity checks")
                .register(meterRegistry);
    }

    // ============================================================================
    // Planner Metrics
    // ============================================================================

    /**
     * Records the plan chosen for one request.
     *
     * @param kind     plan kind
     * @param degraded true when a missing rollup forced the scan
     */
    public void recordPlan(PlanKind kind, boolean degraded) {
        planCounters.get(kind).increment();
        if (degraded) {
            degradedPlanCounter.increment();
        }
        log.debug("Recorded plan: kind={}, degraded={}", kind, degraded);
    }

    // ============================================================================
    // Query Metrics
    // ============================================================================

    public void recordQuery(long durationMs) {
        queryTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordQueryError() {
        queryErrorCounter.increment();
    }

    public void recordQueryTimeout() {
        queryTimeoutCounter.increment();
        log.debug("Recorded query timeout");
    }

    public void recordScan(long rowsRead) {
        scannedRowsDistribution.record(rowsRead);
    }

    // ============================================================================
    // Export Metrics
    // ============================================================================

    public void recordExportRows(long rows) {
        if (rows > 0) {
            exportRowsCounter.increment(rows);
        }
    }

    public void recordExportCompleted() {
        exportCompletedCounter.increment();
    }

    public void recordExportCancelled() {
        exportCancelledCounter.increment();
    }

    public void recordExportFailed() {
        exportFailedCounter.increment();
    }

    // ============================================================================
    // Snapshot Metrics
    // ============================================================================

    public void recordSnapshotActivation() {
        snapshotActivationCounter.increment();
    }

    public void recordInconsistency() {
        inconsistencyCounter.increment();
    }
}
