package com.di.awardscope.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * JSON manifest written by the ingestion pipeline next to each snapshot version
 * ({@code <root>/<version>/manifest.json}).
 *
 * <p>Declares which time buckets the version covers and how many rows each bucket's fact and
 * rollup tables hold. The planner uses it to detect missing data; the aggregator uses the
 * per-bucket totals for global totals and cross-checks rollup tables against it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotManifest {

    private String version;
    private Instant createdAt;

    /** Earliest award date in the primary dataset. */
    private LocalDate minDate;

    /** Latest award date in the primary dataset. */
    private LocalDate maxDate;

    /** Rows in {@code secondary/facts.csv}; 0 when the version ships no secondary dataset. */
    private long secondaryRows;

    @Builder.Default
    private List<BucketEntry> buckets = new ArrayList<>();

    /* ---------------------------------------------------------------------- */

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BucketEntry {

        /** Bucket id, e.g. {@code year_2020_q1}. */
        private String id;

        /** Rows in this bucket's {@code facts.csv}; negative when the bucket ships no fact file. */
        private long factRows;

        /** Sum of contract amounts over the bucket's facts. */
        private double totalValue;

        /** Declared rollup tables keyed by dimension key ({@code contractor}, ...). */
        @Builder.Default
        private Map<String, RollupEntry> rollups = new LinkedHashMap<>();

        @JsonIgnore
        public TimeBucket bucket() {
            return TimeBucket.parse(id);
        }

        @JsonIgnore
        public boolean hasFacts() {
            return factRows >= 0;
        }

        @JsonIgnore
        public Optional<RollupEntry> rollup(EntityDimension dimension) {
            return Optional.ofNullable(rollups != null ? rollups.get(dimension.getKey()) : null);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RollupEntry {

        /** Number of entity rows in the rollup table. */
        private long rows;

        /** Sum of {@code contract_count} over those rows. */
        private long contracts;
    }

    /* ---------------------------------------------------------------------- */

    @JsonIgnore
    public Optional<BucketEntry> find(TimeBucket bucket) {
        if (buckets == null) return Optional.empty();
        String id = bucket.id();
        for (BucketEntry e : buckets) {
            if (id.equals(e.getId())) return Optional.of(e);
        }
        return Optional.empty();
    }

    /** Years that have a {@code year_<y>} entry, ascending. */
    @JsonIgnore
    public TreeSet<Integer> coveredYears() {
        TreeSet<Integer> years = new TreeSet<>();
        if (buckets == null) return years;
        for (BucketEntry e : buckets) {
            TimeBucket b = e.bucket();
            if (b.granularity() == Granularity.YEAR) years.add(b.year());
        }
        return years;
    }

    /**
     * Every calendar year of the dataset's date domain, whether or not it has a {@code year_<y>}
     * entry. Falls back to {@link #coveredYears()} when the manifest carries no date domain.
     */
    @JsonIgnore
    public TreeSet<Integer> datasetYears() {
        if (minDate == null || maxDate == null) {
            return coveredYears();
        }
        TreeSet<Integer> years = new TreeSet<>();
        for (int y = minDate.getYear(); y <= maxDate.getYear(); y++) {
            years.add(y);
        }
        return years;
    }

    /** True when {@code bucket} is declared with a rollup table for {@code dimension}. */
    @JsonIgnore
    public boolean hasRollup(TimeBucket bucket, EntityDimension dimension) {
        return find(bucket).flatMap(e -> e.rollup(dimension)).isPresent();
    }

    /** True when {@code bucket} is declared with a fact file. */
    @JsonIgnore
    public boolean hasFacts(TimeBucket bucket) {
        return find(bucket).map(BucketEntry::hasFacts).orElse(false);
    }
}
