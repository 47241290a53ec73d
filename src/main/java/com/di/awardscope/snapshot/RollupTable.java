package com.di.awardscope.snapshot;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All rollup rows of one (bucket, dimension) pair, keyed by entity name.
 * Immutable once built; shared across requests through the rollup cache.
 */
public final class RollupTable {

    private final TimeBucket bucket;
    private final EntityDimension dimension;
    private final Map<String, EntityRollupRow> rows;
    private final long contractCount;
    private final double totalValue;

    public RollupTable(TimeBucket bucket, EntityDimension dimension, Map<String, EntityRollupRow> rows) {
        this.bucket = bucket;
        this.dimension = dimension;
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
        long count = 0;
        double total = 0.0;
        for (EntityRollupRow r : rows.values()) {
            count += r.getContractCount();
            total += r.getTotalValue();
        }
        this.contractCount = count;
        this.totalValue = total;
    }

    public TimeBucket getBucket() {
        return bucket;
    }

    public EntityDimension getDimension() {
        return dimension;
    }

    public Collection<EntityRollupRow> rows() {
        return rows.values();
    }

    public EntityRollupRow get(String entity) {
        return rows.get(entity);
    }

    public int size() {
        return rows.size();
    }

    /** Sum of contract counts over every row. */
    public long getContractCount() {
        return contractCount;
    }

    public double getTotalValue() {
        return totalValue;
    }
}
