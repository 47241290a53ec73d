package com.di.awardscope.query;

import com.di.awardscope.filter.RawFilterRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/contracts/search}. Without a target dimension raw facts are returned. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {

    @JsonProperty("filters")
    private RawFilterRequest filters;

    @JsonProperty("target_dimension")
    private String targetDimension;

    @JsonProperty("offset")
    private Integer offset;

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("sort")
    private SortRequest sort;
}
