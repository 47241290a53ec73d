package com.di.awardscope.filter;

import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical, validated predicate set. Produced by {@link FilterNormalizer}; everything past the
 * request boundary works on this type and never on the raw payload.
 *
 * <ul>
 *   <li>entity chips: OR within a dimension, AND across dimensions; dimensions without chips are absent</li>
 *   <li>keyword chips: all required, matched against {@link ContractFact#searchText()}</li>
 *   <li>time ranges: sorted, disjoint; empty means all time</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class FilterChipSet {

    public static final FilterChipSet EMPTY = FilterChipSet.builder().build();

    @Builder.Default
    Map<EntityDimension, List<ChipMatcher>> entityFilters = Map.of();

    @Builder.Default
    List<ChipMatcher> keywords = List.of();

    @Builder.Default
    ValueRange valueRange = ValueRange.ALL;

    @Builder.Default
    List<DateInterval> timeRanges = List.of();

    boolean includeSecondaryDataset;

    public boolean hasEntityFilter(EntityDimension dimension) {
        List<ChipMatcher> chips = entityFilters.get(dimension);
        return chips != null && !chips.isEmpty();
    }

    public Set<EntityDimension> filteredDimensions() {
        Set<EntityDimension> dims = EnumSet.noneOf(EntityDimension.class);
        for (EntityDimension d : EntityDimension.values()) {
            if (hasEntityFilter(d)) dims.add(d);
        }
        return dims;
    }

    public List<ChipMatcher> chips(EntityDimension dimension) {
        List<ChipMatcher> chips = entityFilters.get(dimension);
        return chips != null ? chips : Collections.emptyList();
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    public boolean hasTimeRanges() {
        return !timeRanges.isEmpty();
    }

    /** True when nothing but the time ranges constrains the result. */
    public boolean isTimeOnly() {
        return filteredDimensions().isEmpty() && !hasKeywords() && !valueRange.isActive() && !includeSecondaryDataset;
    }

    /** Entity-name predicate of one dimension; blank names never match a chip. */
    public boolean matchesEntity(EntityDimension dimension, String name) {
        List<ChipMatcher> chips = entityFilters.get(dimension);
        if (chips == null || chips.isEmpty()) return true;
        if (name == null || name.isBlank()) return false;
        String lower = name.toLowerCase(Locale.ROOT);
        for (ChipMatcher chip : chips) {
            if (chip.matchesLower(lower)) return true;
        }
        return false;
    }

    public boolean matchesTime(LocalDate date) {
        if (timeRanges.isEmpty()) return true;
        for (DateInterval interval : timeRanges) {
            if (interval.contains(date)) return true;
        }
        return false;
    }

    public boolean matchesKeywords(ContractFact fact) {
        if (keywords.isEmpty()) return true;
        String text = fact.searchText();
        for (ChipMatcher chip : keywords) {
            if (!chip.matchesLower(text)) return false;
        }
        return true;
    }

    /** Every predicate except the time ranges. */
    public boolean matchesNonTime(ContractFact fact) {
        if (!valueRange.contains(fact.getContractAmount())) return false;
        for (Map.Entry<EntityDimension, List<ChipMatcher>> e : entityFilters.entrySet()) {
            if (!e.getValue().isEmpty() && !matchesEntity(e.getKey(), e.getKey().nameOf(fact))) return false;
        }
        return matchesKeywords(fact);
    }

    public boolean matches(ContractFact fact) {
        return matchesTime(fact.getAwardDate()) && matchesNonTime(fact);
    }
}
