package com.di.awardscope.query;

import com.di.awardscope.aggregate.GlobalTotals;
import com.di.awardscope.pagination.RankedAggregate;
import com.di.awardscope.planner.PlanKind;
import com.di.awardscope.planner.PlanReason;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Result of {@code aggregate}: one rank window plus totals for percentage displays. */
public record AggregateResult(
        @JsonProperty("rows") List<RankedAggregate> rows,
        @JsonProperty("global_totals") GlobalTotals globalTotals,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("rank_from") int rankFrom,
        @JsonProperty("rank_to") int rankTo,
        @JsonProperty("plan_kind") PlanKind planKind,
        @JsonProperty("plan_reason") PlanReason planReason,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("snapshot_version") String snapshotVersion) {
}
