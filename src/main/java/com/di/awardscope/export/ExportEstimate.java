package com.di.awardscope.export;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pre-computed size of an export. {@code rowCount} is exact: it equals the rows the stream emits
 * for the same request. {@code byteEstimate} is header bytes plus rows times an average row width.
 */
public record ExportEstimate(
        @JsonProperty("row_count") long rowCount,
        @JsonProperty("byte_estimate") long byteEstimate) {
}
