package com.di.awardscope.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One window of an ordered result.
 *
 * @param rows       the window's rows, in order
 * @param totalCount rows in the whole result
 * @param offset     0-based index of the first row
 * @param limit      requested window size
 * @param hasNext    more rows follow the window
 */
public record Page<T>(
        @JsonProperty("rows") List<T> rows,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("offset") int offset,
        @JsonProperty("limit") int limit,
        @JsonProperty("has_next") boolean hasNext) {

    public Page {
        rows = List.copyOf(rows);
    }
}
