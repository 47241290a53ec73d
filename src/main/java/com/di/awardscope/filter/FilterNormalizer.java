package com.di.awardscope.filter;

import com.di.awardscope.snapshot.EntityDimension;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link RawFilterRequest} into a canonical {@link FilterChipSet}.
 *
 * <p>Pure: no I/O and no state; the dataset's date domain is passed in. Every rejection is a
 * {@link FilterValidationException} naming the payload field, e.g. {@code time_ranges[2]}.
 */
@Slf4j
@Component
public class FilterNormalizer {

    static final int MIN_YEAR = 1;
    static final int MAX_YEAR = 9999;

    public FilterChipSet normalize(RawFilterRequest raw, DatasetBounds bounds) {
        if (raw == null) {
            return FilterChipSet.EMPTY;
        }
        FilterChipSet chips = FilterChipSet.builder()
                .entityFilters(entityFilters(raw.getEntityFilters()))
                .keywords(keywords(raw.getKeywords()))
                .valueRange(valueRange(raw.getValueRange()))
                .timeRanges(timeRanges(raw.getTimeRanges(), bounds))
                .includeSecondaryDataset(Boolean.TRUE.equals(raw.getIncludeSecondaryDataset()))
                .build();
        log.debug("[FILTER] Normalized: dims={}, keywords={}, value={}, time={}, secondary={}",
                chips.filteredDimensions(), chips.getKeywords().size(), chips.getValueRange(),
                chips.getTimeRanges(), chips.isIncludeSecondaryDataset());
        return chips;
    }

    /* ------------------------------------------------------------------ */
    /* Entity chips                                                         */
    /* ------------------------------------------------------------------ */

    private static Map<EntityDimension, List<ChipMatcher>> entityFilters(Map<String, List<String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<EntityDimension, List<ChipMatcher>> out = new EnumMap<>(EntityDimension.class);
        for (Map.Entry<String, List<String>> e : raw.entrySet()) {
            String field = "entity_filters." + e.getKey();
            EntityDimension dimension;
            try {
                dimension = EntityDimension.fromKey(e.getKey());
            } catch (IllegalArgumentException ex) {
                throw new FilterValidationException(field, e.getKey(), "unknown entity dimension", ex);
            }
            List<ChipMatcher> chips = dedupe(e.getValue());
            if (chips.isEmpty()) {
                continue;
            }
            List<ChipMatcher> existing = out.get(dimension);
            if (existing != null) {
                // Same dimension under two aliases (e.g. "area" and "by_area").
                List<String> labels = new ArrayList<>();
                existing.forEach(c -> labels.add(c.label()));
                chips.forEach(c -> labels.add(c.label()));
                chips = dedupe(labels);
            }
            out.put(dimension, chips);
        }
        return Collections.unmodifiableMap(out);
    }

    private static List<ChipMatcher> keywords(List<String> raw) {
        return dedupe(raw);
    }

    /** Trims, drops blanks, dedupes case-insensitively keeping the first spelling. */
    private static List<ChipMatcher> dedupe(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<ChipMatcher> out = new ArrayList<>();
        for (String value : raw) {
            ChipMatcher chip = ChipMatcher.parse(value);
            if (chip != null && seen.add(chip.label().toLowerCase(Locale.ROOT))) {
                out.add(chip);
            }
        }
        return List.copyOf(out);
    }

    /* ------------------------------------------------------------------ */
    /* Value range                                                          */
    /* ------------------------------------------------------------------ */

    private static ValueRange valueRange(RawValueRange raw) {
        if (raw == null) {
            return ValueRange.ALL;
        }
        double min = raw.getMin() != null ? raw.getMin() : 0.0;
        double max = raw.getMax() != null ? raw.getMax() : Double.MAX_VALUE;
        checkBound("value_range.min", min);
        checkBound("value_range.max", max);
        if (min > max) {
            throw new FilterValidationException("value_range", min + ".." + max, "min must not exceed max");
        }
        return new ValueRange(min, max);
    }

    private static void checkBound(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FilterValidationException(field, value, "must be a finite number");
        }
        if (value < 0) {
            throw new FilterValidationException(field, value, "must not be negative");
        }
    }

    /* ------------------------------------------------------------------ */
    /* Time ranges                                                          */
    /* ------------------------------------------------------------------ */

    private static List<DateInterval> timeRanges(List<RawTimeRange> raw, DatasetBounds bounds) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<DateInterval> intervals = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String field = "time_ranges[" + i + "]";
            RawTimeRange entry = raw.get(i);
            if (entry == null) {
                throw new FilterValidationException(field, null, "time range cannot be null");
            }
            DateInterval interval = interpret(field, entry.node());
            intervals.add(clamp(field, interval, bounds));
        }
        return merge(intervals);
    }

    private static DateInterval interpret(String field, JsonNode node) {
        if (node.isArray()) {
            if (node.size() != 2) {
                throw new FilterValidationException(field, node.toString(), "expected [start, end]");
            }
            return interval(field, date(field, node.get(0)), date(field, node.get(1)));
        }
        if (!node.isObject()) {
            throw new FilterValidationException(field, node.toString(), "expected [start, end] or a typed range object");
        }
        String type = node.path("type").asText("custom").trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "yearly", "year" -> {
                yield DateInterval.ofYear(year(field, node));
            }
            case "quarterly", "quarter" -> {
                int year = year(field, node);
                int quarter = intField(field, node, "quarter");
                if (quarter < 1 || quarter > 4) {
                    throw new FilterValidationException(field + ".quarter", quarter, "quarter must be 1..4");
                }
                LocalDate start = LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
                yield new DateInterval(start, start.plusMonths(3).minusDays(1));
            }
            case "custom" -> interval(field,
                    date(field + ".startDate", first(node, "startDate", "start_date", "start")),
                    date(field + ".endDate", first(node, "endDate", "end_date", "end")));
            default -> throw new FilterValidationException(field + ".type", type, "unknown time range type");
        };
    }

    private static DateInterval interval(String field, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new FilterValidationException(field, start + ".." + end, "start is after end");
        }
        return new DateInterval(start, end);
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && !v.isNull()) return v;
        }
        return null;
    }

    private static LocalDate date(String field, JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new FilterValidationException(field, value != null ? value.toString() : null, "expected an ISO date (yyyy-MM-dd)");
        }
        try {
            return LocalDate.parse(value.asText().trim());
        } catch (DateTimeParseException e) {
            throw new FilterValidationException(field, value.asText(), "malformed date", e);
        }
    }

    private static int year(String field, JsonNode node) {
        int year = intField(field, node, "year");
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new FilterValidationException(field + ".year", year,
                    "year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
        return year;
    }

    private static int intField(String field, JsonNode node, String name) {
        JsonNode v = node.get(name);
        if (v != null && v.canConvertToInt() && v.isIntegralNumber()) {
            return v.intValue();
        }
        if (v != null && v.isTextual()) {
            try {
                return Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new FilterValidationException(field + "." + name, v.asText(), "expected an integer", e);
            }
        }
        throw new FilterValidationException(field + "." + name, v != null ? v.toString() : null, "expected an integer");
    }

    /**
     * Rejects intervals outside {@code [minDate, maxDate]}; clamps partial overlaps to
     * {@code [Jan 1 of min year, Dec 31 of max year]}.
     */
    private static DateInterval clamp(String field, DateInterval interval, DatasetBounds bounds) {
        if (bounds == null) {
            return interval;
        }
        if (!interval.overlaps(bounds.minDate(), bounds.maxDate())) {
            throw new FilterValidationException(field, interval.toString(),
                    "outside the dataset's date range " + bounds.minDate() + ".." + bounds.maxDate());
        }
        LocalDate start = interval.start().isBefore(bounds.clampStart()) ? bounds.clampStart() : interval.start();
        LocalDate end = interval.end().isAfter(bounds.clampEnd()) ? bounds.clampEnd() : interval.end();
        return new DateInterval(start, end);
    }

    /** Sorts and merges overlapping or adjacent intervals. */
    static List<DateInterval> merge(List<DateInterval> intervals) {
        List<DateInterval> sorted = new ArrayList<>(intervals);
        Collections.sort(sorted);
        List<DateInterval> out = new ArrayList<>();
        for (DateInterval next : sorted) {
            if (!out.isEmpty() && out.get(out.size() - 1).touches(next)) {
                out.set(out.size() - 1, out.get(out.size() - 1).span(next));
            } else {
                out.add(next);
            }
        }
        return List.copyOf(out);
    }
}
