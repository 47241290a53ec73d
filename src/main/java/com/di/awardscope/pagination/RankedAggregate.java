package com.di.awardscope.pagination;

import com.di.awardscope.aggregate.AggregateRow;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/** An aggregated row with its 1-based position in the sorted result. */
public record RankedAggregate(
        @JsonProperty("rank") int rank,
        @JsonUnwrapped AggregateRow row) {
}
