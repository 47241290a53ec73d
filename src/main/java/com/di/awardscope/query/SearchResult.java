package com.di.awardscope.query;

import com.di.awardscope.planner.PlanKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@code search}: raw facts when no target dimension was given, ranked aggregates otherwise.
 */
public record SearchResult(
        @JsonProperty("rows") List<?> rows,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("offset") int offset,
        @JsonProperty("limit") int limit,
        @JsonProperty("has_next") boolean hasNext,
        @JsonProperty("plan_kind") PlanKind planKind,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("snapshot_version") String snapshotVersion) {
}
