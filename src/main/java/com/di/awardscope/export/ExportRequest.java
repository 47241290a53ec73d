package com.di.awardscope.export;

import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.pagination.RankRange;
import com.di.awardscope.pagination.SortSpec;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.snapshot.Snapshot;

/**
 * A validated and planned export. The estimate and the stream both take one of these, so the two
 * phases read the same snapshot with the same plan.
 *
 * @param rankRange window of an aggregated export; {@code null} for the whole result
 */
public record ExportRequest(
        Snapshot snapshot,
        FilterChipSet chips,
        QueryPlan plan,
        SortSpec sort,
        RankRange rankRange,
        ExportFormat format) {

    public boolean isAggregated() {
        return plan.targetDimension() != null;
    }
}
