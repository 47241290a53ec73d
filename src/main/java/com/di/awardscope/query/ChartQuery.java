package com.di.awardscope.query;

import com.di.awardscope.filter.RawFilterRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/contracts/charts}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartQuery {

    @JsonProperty("filters")
    private RawFilterRequest filters;

    /** Entities per dimension; defaults to {@code default-top-n}. */
    @JsonProperty("top_n")
    private Integer topN;
}
