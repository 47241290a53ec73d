package com.di.awardscope.planner;

/** Why the planner chose the plan kind it did. */
public enum PlanReason {
    ROLLUP_ALIGNED("time cover is a union of whole buckets with rollups for the target dimension"),
    RAW_FACTS("no target dimension; raw fact rows requested"),
    KEYWORD_FILTER("rollups carry no keyword breakdown"),
    VALUE_RANGE_FILTER("rollups hold summed values, not individual contract amounts"),
    SECONDARY_DATASET("rollups cover the primary dataset only"),
    CROSS_DIMENSION_FILTER("entity filter on a dimension other than the target"),
    UNALIGNED_TIME_RANGE("time ranges do not align to whole buckets"),
    MISSING_ROLLUP("a bucket or rollup table required by the time cover is missing");

    private final String description;

    PlanReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
