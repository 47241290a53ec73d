package com.di.awardscope.aggregate;

import com.di.awardscope.planner.QueryPlan;

import java.util.List;

/**
 * Merged rows (unordered) plus global totals for one request.
 */
public record AggregationResult(QueryPlan plan, List<AggregateRow> rows, GlobalTotals globalTotals) {

    public AggregationResult {
        rows = List.copyOf(rows);
    }
}
