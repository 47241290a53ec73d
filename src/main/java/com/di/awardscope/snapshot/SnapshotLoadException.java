package com.di.awardscope.snapshot;

/**
 * Thrown when a snapshot version directory, its manifest or one of its data files cannot be read.
 */
public class SnapshotLoadException extends RuntimeException {

    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
