package com.di.awardscope.query;

/**
 * A query exceeded {@code awardscope.query.timeout-ms}. The worker was interrupted and no partial
 * result is returned.
 */
public class QueryTimeoutException extends RuntimeException {

    private final String operation;
    private final long timeoutMs;

    public QueryTimeoutException(String operation, long timeoutMs) {
        super(operation + " exceeded the query timeout of " + timeoutMs + " ms");
        this.operation = operation;
        this.timeoutMs = timeoutMs;
    }

    public String getOperation() {
        return operation;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
