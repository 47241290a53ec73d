package com.di.awardscope.query;

import com.di.awardscope.filter.RawFilterRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/contracts/export} and {@code /export/estimate}. Without a target
 * dimension raw facts are exported; a rank range applies to aggregated exports only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportQuery {

    @JsonProperty("filters")
    private RawFilterRequest filters;

    @JsonProperty("target_dimension")
    private String targetDimension;

    /** {@code csv} (default) or {@code tsv}. */
    @JsonProperty("format")
    private String format;

    @JsonProperty("sort")
    private SortRequest sort;

    @JsonProperty("rank_from")
    private Integer rankFrom;

    @JsonProperty("rank_to")
    private Integer rankTo;
}
