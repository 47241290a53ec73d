package com.di.awardscope.snapshot;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A time-partitioned slice of pre-computed data: all-time, one year, or one quarter.
 * The id doubles as the bucket's directory name inside a snapshot version.
 *
 * <p>{@code year} and {@code quarter} are 0 when not applicable.
 */
public record TimeBucket(Granularity granularity, int year, int quarter) implements Comparable<TimeBucket> {

    private static final Pattern YEAR_ID = Pattern.compile("year_(\\d{4})");
    private static final Pattern QUARTER_ID = Pattern.compile("year_(\\d{4})_q([1-4])");

    public static final TimeBucket ALL_TIME = new TimeBucket(Granularity.ALL_TIME, 0, 0);

    public TimeBucket {
        if (granularity == null) throw new IllegalArgumentException("granularity cannot be null");
        if (granularity == Granularity.QUARTER && (quarter < 1 || quarter > 4)) {
            throw new IllegalArgumentException("quarter must be 1..4, got " + quarter);
        }
    }

    public static TimeBucket year(int year) {
        return new TimeBucket(Granularity.YEAR, year, 0);
    }

    public static TimeBucket quarter(int year, int quarter) {
        return new TimeBucket(Granularity.QUARTER, year, quarter);
    }

    /** Bucket of the given granularity that contains {@code date}. */
    public static TimeBucket containing(Granularity granularity, LocalDate date) {
        return switch (granularity) {
            case ALL_TIME -> ALL_TIME;
            case YEAR -> year(date.getYear());
            case QUARTER -> quarter(date.getYear(), (date.getMonthValue() - 1) / 3 + 1);
        };
    }

    /** Directory / manifest id: {@code all_time}, {@code year_2020}, {@code year_2020_q3}. */
    public String id() {
        return switch (granularity) {
            case ALL_TIME -> "all_time";
            case YEAR -> "year_" + year;
            case QUARTER -> "year_" + year + "_q" + quarter;
        };
    }

    /**
     * Parses a bucket id.
     *
     * @throws IllegalArgumentException for ids that name no bucket
     */
    public static TimeBucket parse(String id) {
        if ("all_time".equals(id)) return ALL_TIME;
        if (id != null) {
            Matcher q = QUARTER_ID.matcher(id);
            if (q.matches()) return quarter(Integer.parseInt(q.group(1)), Integer.parseInt(q.group(2)));
            Matcher y = YEAR_ID.matcher(id);
            if (y.matches()) return year(Integer.parseInt(y.group(1)));
        }
        throw new IllegalArgumentException("Not a bucket id: '" + id + "'");
    }

    /** First day covered, or {@link LocalDate#MIN} for all-time. */
    public LocalDate start() {
        return switch (granularity) {
            case ALL_TIME -> LocalDate.MIN;
            case YEAR -> LocalDate.of(year, 1, 1);
            case QUARTER -> LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
        };
    }

    /** Last day covered (inclusive), or {@link LocalDate#MAX} for all-time. */
    public LocalDate end() {
        return switch (granularity) {
            case ALL_TIME -> LocalDate.MAX;
            case YEAR -> LocalDate.of(year, 12, 31);
            case QUARTER -> start().plusMonths(3).minusDays(1);
        };
    }

    /** Next bucket of the same granularity. Not defined for all-time. */
    public TimeBucket next() {
        return switch (granularity) {
            case ALL_TIME -> throw new IllegalStateException("all_time has no successor");
            case YEAR -> year(year + 1);
            case QUARTER -> quarter == 4 ? quarter(year + 1, 1) : quarter(year, quarter + 1);
        };
    }

    @Override
    public int compareTo(TimeBucket o) {
        int c = granularity.compareTo(o.granularity);
        if (c != 0) return c;
        c = Integer.compare(year, o.year);
        return c != 0 ? c : Integer.compare(quarter, o.quarter);
    }

    @Override
    public String toString() {
        return id();
    }
}
