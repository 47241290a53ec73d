package com.di.awardscope.query;

import com.di.awardscope.filter.RawFilterRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/contracts/aggregate}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateQuery {

    @JsonProperty("filters")
    private RawFilterRequest filters;

    @JsonProperty("target_dimension")
    private String targetDimension;

    @JsonProperty("sort")
    private SortRequest sort;

    /** First rank (1-based, inclusive); defaults to 1. */
    @JsonProperty("rank_from")
    private Integer rankFrom;

    /** Last rank (inclusive); defaults to {@code rank_from + default-limit - 1}. */
    @JsonProperty("rank_to")
    private Integer rankTo;
}
