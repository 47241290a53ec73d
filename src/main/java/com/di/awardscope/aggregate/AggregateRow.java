package com.di.awardscope.aggregate;

import com.di.awardscope.snapshot.EntityDimension;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Final measures of one entity after all partial aggregates were merged.
 * {@code averageValue} is always {@code totalValue / contractCount} of the merged sums.
 */
@Value
@Builder
public class AggregateRow {

    @JsonIgnore
    EntityDimension dimension;

    @JsonProperty("entity")
    String entity;

    @JsonProperty("contract_count")
    long contractCount;

    @JsonProperty("total_value")
    double totalValue;

    @JsonProperty("average_value")
    double averageValue;

    @JsonProperty("first_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate firstDate;

    @JsonProperty("last_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate lastDate;

    /** Distinct counterpart counts keyed by plural dimension key, e.g. {@code organizations}. */
    @JsonProperty("counterpart_counts")
    Map<String, Integer> counterpartCounts;

    public int counterpartCount(EntityDimension other) {
        Integer n = counterpartCounts.get(other.getPluralKey());
        return n != null ? n : 0;
    }
}
