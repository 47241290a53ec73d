package com.di.awardscope.filter;

/**
 * A filter payload or request parameter is malformed or out of domain. Raised at the request
 * boundary, before planning, and reported to the caller with the offending field and value.
 */
public class FilterValidationException extends IllegalArgumentException {

    private final String field;
    private final transient Object rejectedValue;

    public FilterValidationException(String field, Object rejectedValue, String message) {
        super(field + ": " + message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public FilterValidationException(String field, Object rejectedValue, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    /** Payload path of the offending field, e.g. {@code time_ranges[1]} or {@code value_range.min}. */
    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
