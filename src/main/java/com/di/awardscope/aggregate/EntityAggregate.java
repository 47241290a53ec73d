package com.di.awardscope.aggregate;

import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.EntityRollupRow;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Running totals of one entity. Fed either fact by fact (scan) or rollup row by rollup row
 * (merge); both paths produce the same measures. Not thread-safe.
 */
final class EntityAggregate {

    private final EntityDimension dimension;
    private final String entity;
    private long contractCount;
    private double totalValue;
    private LocalDate firstDate;
    private LocalDate lastDate;
    private final Map<EntityDimension, Set<String>> counterparts = new EnumMap<>(EntityDimension.class);

    EntityAggregate(EntityDimension dimension, String entity) {
        this.dimension = dimension;
        this.entity = entity;
        for (EntityDimension other : dimension.counterparts()) {
            counterparts.put(other, new HashSet<>());
        }
    }

    void add(ContractFact fact) {
        contractCount++;
        totalValue += fact.getContractAmount();
        widen(fact.getAwardDate(), fact.getAwardDate());
        for (Map.Entry<EntityDimension, Set<String>> e : counterparts.entrySet()) {
            String name = e.getKey().nameOf(fact);
            if (name != null && !name.isBlank()) {
                e.getValue().add(name.trim());
            }
        }
    }

    /** Sums counts and values, unions counterpart sets, widens the date span. */
    void merge(EntityRollupRow row) {
        contractCount += row.getContractCount();
        totalValue += row.getTotalValue();
        widen(row.getFirstDate(), row.getLastDate());
        for (Map.Entry<EntityDimension, Set<String>> e : counterparts.entrySet()) {
            e.getValue().addAll(row.counterparts(e.getKey()));
        }
    }

    private void widen(LocalDate first, LocalDate last) {
        if (first != null && (firstDate == null || first.isBefore(firstDate))) {
            firstDate = first;
        }
        if (last != null && (lastDate == null || last.isAfter(lastDate))) {
            lastDate = last;
        }
    }

    long contractCount() {
        return contractCount;
    }

    AggregateRow toRow() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (EntityDimension other : dimension.counterparts()) {
            counts.put(other.getPluralKey(), counterparts.get(other).size());
        }
        return AggregateRow.builder()
                .dimension(dimension)
                .entity(entity)
                .contractCount(contractCount)
                .totalValue(totalValue)
                .averageValue(totalValue / contractCount)
                .firstDate(firstDate)
                .lastDate(lastDate)
                .counterpartCounts(counts)
                .build();
    }
}
