package com.di.awardscope.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Values a client can offer as filter chips for the active snapshot.
 */
public record FilterOptions(
        @JsonProperty("contractors") List<String> contractors,
        @JsonProperty("organizations") List<String> organizations,
        @JsonProperty("areas") List<String> areas,
        @JsonProperty("business_categories") List<String> businessCategories,
        @JsonProperty("years") List<Integer> years) {
}
