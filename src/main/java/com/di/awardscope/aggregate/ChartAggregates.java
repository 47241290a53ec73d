package com.di.awardscope.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Grouped totals of the filtered facts for the chart panels: a summary, per-year and per-month
 * series, and the top entities of every dimension by total value.
 */
public record ChartAggregates(
        @JsonProperty("summary") GlobalTotals summary,
        @JsonProperty("by_year") List<YearTotal> byYear,
        @JsonProperty("by_month") List<MonthTotal> byMonth,
        @JsonProperty("by_contractor") List<LabelTotal> byContractor,
        @JsonProperty("by_organization") List<LabelTotal> byOrganization,
        @JsonProperty("by_area") List<LabelTotal> byArea,
        @JsonProperty("by_category") List<LabelTotal> byCategory) {

    public record YearTotal(
            @JsonProperty("year") int year,
            @JsonProperty("total_value") double totalValue,
            @JsonProperty("count") long count) {
    }

    /** {@code month} is {@code yyyy-MM}. */
    public record MonthTotal(
            @JsonProperty("month") String month,
            @JsonProperty("total_value") double totalValue,
            @JsonProperty("count") long count) {
    }

    public record LabelTotal(
            @JsonProperty("label") String label,
            @JsonProperty("total_value") double totalValue,
            @JsonProperty("count") long count) {
    }
}
