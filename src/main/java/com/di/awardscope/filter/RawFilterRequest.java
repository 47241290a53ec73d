package com.di.awardscope.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Filter payload shared by every query and export operation, mirroring the wire format;
 * {@link FilterNormalizer} turns it into a {@link FilterChipSet} or rejects it.
 *
 * <pre>
 * {"entity_filters": {"contractor": ["ACME CORP"], "area": []},
 *  "keywords": ["road", "concrete &amp;&amp; bridge"],
 *  "value_range": {"min": 0, "max": 1000000},
 *  "time_ranges": [["2020-01-01", "2020-12-31"], {"type": "quarterly", "year": 2021, "quarter": 2}],
 *  "include_secondary_dataset": false}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFilterRequest {

    /** Dimension key to entity names; keys are {@code contractor}, {@code organization}, {@code area}, {@code business_category}. */
    @JsonProperty("entity_filters")
    private Map<String, List<String>> entityFilters;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("value_range")
    private RawValueRange valueRange;

    @JsonProperty("time_ranges")
    private List<RawTimeRange> timeRanges;

    @JsonProperty("include_secondary_dataset")
    private Boolean includeSecondaryDataset;
}
