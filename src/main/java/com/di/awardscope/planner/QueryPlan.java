package com.di.awardscope.planner;

import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.TimeBucket;

import java.util.List;

/**
 * Execution plan for one request.
 *
 * @param kind             plan kind
 * @param targetDimension  dimension results are grouped by; {@code null} for raw fact plans
 * @param rollupBuckets    rollup tables to merge (empty for scans)
 * @param factBuckets      fact files to stream, in order (empty for rollup plans)
 * @param includeSecondary append the secondary dataset's fact file to the scan
 * @param timeCover        whole buckets exactly covering the time ranges; empty when no single
 *                         granularity aligns
 * @param reason           why this kind was chosen
 * @param degraded         a rollup plan was wanted but the data was missing
 */
public record QueryPlan(
        PlanKind kind,
        EntityDimension targetDimension,
        List<TimeBucket> rollupBuckets,
        List<TimeBucket> factBuckets,
        boolean includeSecondary,
        List<TimeBucket> timeCover,
        PlanReason reason,
        boolean degraded) {

    public QueryPlan {
        rollupBuckets = List.copyOf(rollupBuckets);
        factBuckets = List.copyOf(factBuckets);
        timeCover = List.copyOf(timeCover);
    }

    public boolean isRollup() {
        return kind != PlanKind.FACT_SCAN;
    }

    public boolean isTimeAligned() {
        return !timeCover.isEmpty();
    }

    @Override
    public String toString() {
        return kind + "(" + reason + (degraded ? ", degraded" : "") + ", target=" + targetDimension
                + ", rollups=" + rollupBuckets + ", facts=" + factBuckets
                + (includeSecondary ? "+secondary" : "") + ")";
    }
}
