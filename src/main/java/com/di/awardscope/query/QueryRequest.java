package com.di.awardscope.query;

import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.pagination.SortSpec;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.Snapshot;

/**
 * A request after boundary validation: the snapshot captured when it arrived, the canonical chips,
 * the target dimension ({@code null} for raw facts) and the sort.
 */
public record QueryRequest(Snapshot snapshot, FilterChipSet chips, EntityDimension target, SortSpec sort) {
}
