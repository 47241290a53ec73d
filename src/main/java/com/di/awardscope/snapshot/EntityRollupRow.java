package com.di.awardscope.snapshot;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

/**
 * Pre-aggregated measures for one entity in one bucket of one dimension.
 *
 * <p>No stored average; it is derived from {@code totalValue / contractCount} after merging.
 */
@Value
@Builder
public class EntityRollupRow {

    EntityDimension dimension;
    String entity;
    TimeBucket bucket;
    long contractCount;
    double totalValue;
    LocalDate firstDate;
    LocalDate lastDate;

    /** Distinct names in each of the other three dimensions this entity dealt with. */
    @Singular("counterpart")
    Map<EntityDimension, Set<String>> counterparts;

    public Set<String> counterparts(EntityDimension other) {
        Set<String> names = counterparts.get(other);
        return names != null ? names : Set.of();
    }
}
