package com.di.awardscope.snapshot;

/**
 * Time granularity of pre-computed buckets, coarsest first.
 */
public enum Granularity {
    ALL_TIME,
    YEAR,
    QUARTER
}
