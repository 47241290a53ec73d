package com.di.awardscope.snapshot;

/**
 * A rollup table disagrees with its manifest or with itself. The snapshot is corrupt: the error is
 * fatal for the request and is never retried, since immutable data would reproduce it.
 */
public class InternalInconsistencyException extends RuntimeException {

    private final String bucketId;
    private final String dimension;

    public InternalInconsistencyException(TimeBucket bucket, EntityDimension dimension, String message) {
        super("Snapshot inconsistency in " + bucket.id() + "/" + dimension.getKey() + ": " + message);
        this.bucketId = bucket.id();
        this.dimension = dimension.getKey();
    }

    public String getBucketId() {
        return bucketId;
    }

    public String getDimension() {
        return dimension;
    }
}
