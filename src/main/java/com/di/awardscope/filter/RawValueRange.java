package com.di.awardscope.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** {@code value_range} as sent by the client; either bound may be absent. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawValueRange {

    @JsonProperty("min")
    private Double min;

    @JsonProperty("max")
    private Double max;
}
