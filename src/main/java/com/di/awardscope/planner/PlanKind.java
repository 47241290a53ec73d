package com.di.awardscope.planner;

/** How a request is answered. */
public enum PlanKind {
    /** One pre-computed rollup table, filtered by the target-dimension chips. */
    SINGLE_BUCKET_ROLLUP,
    /** Several rollup tables of one granularity, merged by entity name. */
    MULTI_BUCKET_ROLLUP,
    /** Stream the fact rows and evaluate every predicate. */
    FACT_SCAN
}
