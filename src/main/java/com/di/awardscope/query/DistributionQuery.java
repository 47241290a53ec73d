package com.di.awardscope.query;

import com.di.awardscope.filter.RawFilterRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/contracts/value-distribution}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionQuery {

    @JsonProperty("filters")
    private RawFilterRequest filters;

    @JsonProperty("num_bins")
    private Integer numBins;
}
