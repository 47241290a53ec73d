package com.di.awardscope.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Totals over the unfiltered data of the requested time range, used as the denominator of
 * percentage-of-total displays.
 */
public record GlobalTotals(
        @JsonProperty("contract_count") long contractCount,
        @JsonProperty("total_value") double totalValue,
        @JsonProperty("average_value") double averageValue) {

    public static final GlobalTotals EMPTY = new GlobalTotals(0, 0.0, 0.0);

    public static GlobalTotals of(long contractCount, double totalValue) {
        return new GlobalTotals(contractCount, totalValue, contractCount > 0 ? totalValue / contractCount : 0.0);
    }
}
