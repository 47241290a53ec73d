package com.di.awardscope.snapshot;

/**
 * Thrown when a query arrives while no snapshot version is active (e.g. the data root is empty).
 *
 * <p>Mapped to 503 Service Unavailable by {@link com.di.awardscope.exception.GlobalExceptionHandler}.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message) {
        super(message);
    }
}
