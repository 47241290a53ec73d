package com.di.awardscope.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Histogram of positive contract amounts over {@code num_bins} equal-width bins between the
 * smallest and largest amount. Only non-empty bins are listed.
 */
public record ValueDistribution(
        @JsonProperty("min_value") double minValue,
        @JsonProperty("max_value") double maxValue,
        @JsonProperty("bin_width") double binWidth,
        @JsonProperty("num_bins") int numBins,
        @JsonProperty("total_contracts") long totalContracts,
        @JsonProperty("bins") List<Bin> bins) {

    public static ValueDistribution empty(int numBins) {
        return new ValueDistribution(0.0, 0.0, 0.0, numBins, 0, List.of());
    }

    /** Bin {@code n} (1-based) spans {@code [min + (n-1) * width, min + n * width)}; the last bin is closed. */
    public record Bin(
            @JsonProperty("bin_number") int binNumber,
            @JsonProperty("bin_start") double binStart,
            @JsonProperty("bin_end") double binEnd,
            @JsonProperty("count") long count,
            @JsonProperty("total_value") double totalValue,
            @JsonProperty("avg_value") double avgValue) {
    }
}
