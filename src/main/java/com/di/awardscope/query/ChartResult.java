package com.di.awardscope.query;

import com.di.awardscope.planner.PlanKind;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of {@code charts} and {@code valueDistribution}. */
public record ChartResult<T>(
        @JsonProperty("data") T data,
        @JsonProperty("plan_kind") PlanKind planKind,
        @JsonProperty("snapshot_version") String snapshotVersion) {
}
