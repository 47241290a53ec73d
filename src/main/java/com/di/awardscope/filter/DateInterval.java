package com.di.awardscope.filter;

import java.time.LocalDate;

/** Inclusive range of award dates. */
public record DateInterval(LocalDate start, LocalDate end) implements Comparable<DateInterval> {

    public DateInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("interval bounds cannot be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("interval start " + start + " is after end " + end);
        }
    }

    public static DateInterval of(String start, String end) {
        return new DateInterval(LocalDate.parse(start), LocalDate.parse(end));
    }

    public static DateInterval ofYear(int year) {
        return new DateInterval(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean overlaps(LocalDate from, LocalDate to) {
        return !end.isBefore(from) && !start.isAfter(to);
    }

    /** True when the two intervals share a day or {@code other} starts the day after this one ends. */
    public boolean touches(DateInterval other) {
        return !other.start.isAfter(end.plusDays(1)) && !start.isAfter(other.end.plusDays(1));
    }

    public DateInterval span(DateInterval other) {
        return new DateInterval(
                start.isBefore(other.start) ? start : other.start,
                end.isAfter(other.end) ? end : other.end);
    }

    @Override
    public int compareTo(DateInterval o) {
        int c = start.compareTo(o.start);
        return c != 0 ? c : end.compareTo(o.end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
