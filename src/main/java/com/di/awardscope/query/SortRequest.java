package com.di.awardscope.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** {@code sort} of a request body: {@code {"field": "total_value", "direction": "desc"}}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SortRequest {

    @JsonProperty("field")
    private String field;

    @JsonProperty("direction")
    private String direction;
}
