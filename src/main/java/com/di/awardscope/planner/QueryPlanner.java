package com.di.awardscope.planner;

import com.di.awardscope.filter.DateInterval;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.Granularity;
import com.di.awardscope.snapshot.SnapshotManifest;
import com.di.awardscope.snapshot.TimeBucket;
import com.di.awardscope.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Chooses between a single rollup read, a multi-bucket rollup merge and a fact scan.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>no target dimension: scan ({@link PlanReason#RAW_FACTS})</li>
 *   <li>any keyword: scan</li>
 *   <li>active value range: scan</li>
 *   <li>secondary dataset requested: scan</li>
 *   <li>entity chips on a dimension other than the target: scan</li>
 *   <li>time ranges not a union of whole years or whole quarters: scan</li>
 *   <li>a covering bucket or its rollup missing from the manifest: degraded scan</li>
 *   <li>otherwise one or several rollup tables</li>
 * </ol>
 * Chips on the target dimension never change the plan; they filter rollup rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryPlanner {

    private final MetricsCollector metricsCollector;

    public QueryPlan plan(FilterChipSet chips, EntityDimension target, SnapshotManifest manifest) {
        List<TimeBucket> cover = timeCover(chips.getTimeRanges(), manifest, target);
        QueryPlan plan = choose(chips, target, manifest, cover);
        metricsCollector.recordPlan(plan.kind(), plan.degraded());
        if (plan.degraded()) {
            log.warn("[PLANNER] Degraded plan: {} rollup missing for cover {}; falling back to fact scan of {}",
                    target.getKey(), cover, plan.factBuckets());
        } else {
            log.debug("[PLANNER] {}", plan);
        }
        return plan;
    }

    private QueryPlan choose(FilterChipSet chips, EntityDimension target, SnapshotManifest manifest, List<TimeBucket> cover) {
        if (target == null) {
            return scan(chips, null, manifest, cover, PlanReason.RAW_FACTS, false);
        }
        if (chips.hasKeywords()) {
            return scan(chips, target, manifest, cover, PlanReason.KEYWORD_FILTER, false);
        }
        if (chips.getValueRange().isActive()) {
            return scan(chips, target, manifest, cover, PlanReason.VALUE_RANGE_FILTER, false);
        }
        if (chips.isIncludeSecondaryDataset()) {
            return scan(chips, target, manifest, cover, PlanReason.SECONDARY_DATASET, false);
        }
        for (EntityDimension d : chips.filteredDimensions()) {
            if (d != target) {
                return scan(chips, target, manifest, cover, PlanReason.CROSS_DIMENSION_FILTER, false);
            }
        }
        if (cover.isEmpty()) {
            return scan(chips, target, manifest, cover, PlanReason.UNALIGNED_TIME_RANGE, false);
        }
        for (TimeBucket bucket : cover) {
            if (!manifest.hasRollup(bucket, target)) {
                return scan(chips, target, manifest, cover, PlanReason.MISSING_ROLLUP, true);
            }
        }
        PlanKind kind = cover.size() == 1 ? PlanKind.SINGLE_BUCKET_ROLLUP : PlanKind.MULTI_BUCKET_ROLLUP;
        return new QueryPlan(kind, target, cover, List.of(), false, cover, PlanReason.ROLLUP_ALIGNED, false);
    }

    private static QueryPlan scan(FilterChipSet chips, EntityDimension target, SnapshotManifest manifest,
                                  List<TimeBucket> cover, PlanReason reason, boolean degraded) {
        return new QueryPlan(PlanKind.FACT_SCAN, target, List.of(), factBuckets(chips, manifest),
                chips.isIncludeSecondaryDataset(), cover, reason, degraded);
    }

    /* ------------------------------------------------------------------ */
    /* Time cover                                                           */
    /* ------------------------------------------------------------------ */

    /**
     * Whole buckets of one granularity whose union is exactly the time ranges, coarsest first.
     * Returns {@code [all_time]} for no ranges and an empty list when neither years nor quarters align.
     * <ul>
     *   <li>A year cover spanning every year of the dataset's date domain collapses to {@code all_time}
     *       when that bucket can serve the target (its rollup, or its fact file for raw plans).</li>
     *   <li>A year cover with a missing year rollup gives way to the quarter cover of the same ranges
     *       when every quarter has the rollup.</li>
     * </ul>
     * A cover that cannot serve the target is still returned so that the plan degrades.
     */
    static List<TimeBucket> timeCover(List<DateInterval> intervals, SnapshotManifest manifest, EntityDimension target) {
        if (intervals.isEmpty()) {
            return List.of(TimeBucket.ALL_TIME);
        }
        Optional<List<TimeBucket>> years = alignedCover(intervals, Granularity.YEAR);
        if (years.isPresent()) {
            List<TimeBucket> yearCover = years.get();
            if (coversEveryYear(yearCover, manifest) && serves(List.of(TimeBucket.ALL_TIME), manifest, target)) {
                return List.of(TimeBucket.ALL_TIME);
            }
            if (target == null || serves(yearCover, manifest, target)) {
                return yearCover;
            }
            List<TimeBucket> quarterCover = alignedCover(intervals, Granularity.QUARTER).orElse(List.of());
            return !quarterCover.isEmpty() && serves(quarterCover, manifest, target) ? quarterCover : yearCover;
        }
        return alignedCover(intervals, Granularity.QUARTER).orElse(List.of());
    }

    private static Optional<List<TimeBucket>> alignedCover(List<DateInterval> intervals, Granularity granularity) {
        List<TimeBucket> buckets = new ArrayList<>();
        for (DateInterval interval : intervals) {
            TimeBucket first = TimeBucket.containing(granularity, interval.start());
            TimeBucket last = TimeBucket.containing(granularity, interval.end());
            if (!first.start().equals(interval.start()) || !last.end().equals(interval.end())) {
                return Optional.empty();
            }
            for (TimeBucket b = first; b.compareTo(last) <= 0; b = b.next()) {
                buckets.add(b);
            }
        }
        return Optional.of(buckets);
    }

    private static boolean coversEveryYear(List<TimeBucket> yearCover, SnapshotManifest manifest) {
        Set<Integer> covered = new TreeSet<>();
        for (TimeBucket b : yearCover) {
            covered.add(b.year());
        }
        TreeSet<Integer> all = manifest.datasetYears();
        return !all.isEmpty() && covered.containsAll(all);
    }

    /** Rollups of {@code target} for every bucket, or fact files when {@code target} is null. */
    private static boolean serves(List<TimeBucket> buckets, SnapshotManifest manifest, EntityDimension target) {
        for (TimeBucket b : buckets) {
            boolean ok = target != null ? manifest.hasRollup(b, target) : manifest.hasFacts(b);
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    /* ------------------------------------------------------------------ */
    /* Fact buckets                                                         */
    /* ------------------------------------------------------------------ */

    /**
     * Year fact files overlapping the time ranges when the manifest has all of them, otherwise the
     * all-time fact file. Time predicates are still applied row by row.
     */
    static List<TimeBucket> factBuckets(FilterChipSet chips, SnapshotManifest manifest) {
        if (!chips.hasTimeRanges()) {
            return List.of(TimeBucket.ALL_TIME);
        }
        TreeSet<TimeBucket> years = new TreeSet<>();
        for (DateInterval interval : chips.getTimeRanges()) {
            for (int y = interval.start().getYear(); y <= interval.end().getYear(); y++) {
                years.add(TimeBucket.year(y));
            }
        }
        for (TimeBucket year : years) {
            if (!manifest.hasFacts(year)) {
                return List.of(TimeBucket.ALL_TIME);
            }
        }
        return new ArrayList<>(years);
    }
}
