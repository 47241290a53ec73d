package com.di.awardscope.aggregate;

import com.di.awardscope.filter.ChipMatcher;
import com.di.awardscope.filter.DateInterval;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.filter.ValueRange;
import com.di.awardscope.planner.PlanKind;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.planner.QueryPlanner;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.InternalInconsistencyException;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotFixture;
import com.di.awardscope.snapshot.TimeBucket;
import com.di.awardscope.util.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for Aggregator: rollup merges and fact scans must agree.
 */
@DisplayName("Aggregator Tests")
class AggregatorTest {

    @TempDir
    Path root;

    private QueryPlanner planner;
    private Aggregator aggregator;
    private Snapshot snapshot;

    @BeforeEach
    void setUp() {
        MetricsCollector metrics = SnapshotFixture.metrics();
        planner = new QueryPlanner(metrics);
        aggregator = new Aggregator(new FactScanner(metrics));
        snapshot = SnapshotFixture.store(SnapshotFixture.in(root).write(), metrics).current();
    }

    private AggregationResult run(FilterChipSet chips, EntityDimension dim) {
        return run(snapshot, chips, dim);
    }

    private AggregationResult run(Snapshot s, FilterChipSet chips, EntityDimension dim) {
        QueryPlan plan = planner.plan(chips, dim, s.getManifest());
        return aggregator.aggregate(s, plan, chips);
    }

    private static FilterChipSet year2020() {
        return FilterChipSet.builder().timeRanges(List.of(DateInterval.ofYear(2020))).build();
    }

    private static Map<String, AggregateRow> byEntity(AggregationResult result) {
        return result.rows().stream().collect(Collectors.toMap(AggregateRow::getEntity, Function.identity()));
    }

    private static void assertSameRows(AggregationResult expected, AggregationResult actual) {
        Map<String, AggregateRow> e = byEntity(expected);
        Map<String, AggregateRow> a = byEntity(actual);
        assertEquals(e.keySet(), a.keySet());
        for (String entity : e.keySet()) {
            AggregateRow x = e.get(entity);
            AggregateRow y = a.get(entity);
            assertEquals(x.getContractCount(), y.getContractCount(), entity);
            assertEquals(x.getTotalValue(), y.getTotalValue(), 1e-9, entity);
            assertEquals(x.getAverageValue(), y.getAverageValue(), 1e-9, entity);
            assertEquals(x.getFirstDate(), y.getFirstDate(), entity);
            assertEquals(x.getLastDate(), y.getLastDate(), entity);
            assertEquals(x.getCounterpartCounts(), y.getCounterpartCounts(), entity);
        }
    }

    @Test
    @DisplayName("Should total ACME CORP's 2020 contracts to 2 / 300 / 150")
    void testAggregate_AcmeCorp2020() {
        FilterChipSet chips = year2020().toBuilder()
                .entityFilters(Map.of(EntityDimension.CONTRACTOR, List.of(ChipMatcher.parse("ACME CORP"))))
                .build();

        AggregationResult result = run(chips, EntityDimension.CONTRACTOR);

        assertEquals(PlanKind.SINGLE_BUCKET_ROLLUP, result.plan().kind());
        assertEquals(1, result.rows().size());
        AggregateRow acme = result.rows().get(0);
        assertEquals("ACME CORP", acme.getEntity());
        assertEquals(2, acme.getContractCount());
        assertEquals(300.0, acme.getTotalValue(), 1e-9);
        assertEquals(150.0, acme.getAverageValue(), 1e-9);
    }

    @Test
    @DisplayName("Should merge four quarters into the year's totals and recompute averages")
    void testAggregate_QuarterMergeEqualsYear() {
        FilterChipSet quarters = FilterChipSet.builder()
                .timeRanges(List.of(DateInterval.of("2020-01-01", "2020-06-30"), DateInterval.of("2020-07-01", "2020-12-31")))
                .build();

        AggregationResult merged = run(quarters, EntityDimension.CONTRACTOR);
        AggregationResult year = run(year2020(), EntityDimension.CONTRACTOR);

        assertEquals(PlanKind.MULTI_BUCKET_ROLLUP, merged.plan().kind());
        assertEquals(4, merged.plan().rollupBuckets().size());
        assertSameRows(year, merged);
        assertEquals(150.0, byEntity(merged).get("ACME CORP").getAverageValue(), 1e-9);
    }

    @Test
    @DisplayName("Should produce the same rows from a fact scan as from rollups")
    void testAggregate_ScanMatchesRollup() {
        FilterChipSet wide = year2020().toBuilder().valueRange(new ValueRange(0.0, 1.0e12)).build();

        AggregationResult scanned = run(wide, EntityDimension.ORGANIZATION);
        AggregationResult rolled = run(year2020(), EntityDimension.ORGANIZATION);

        assertEquals(PlanKind.FACT_SCAN, scanned.plan().kind());
        assertSameRows(rolled, scanned);
    }

    @Test
    @DisplayName("Should report all-time global totals for empty filters")
    void testAggregate_GlobalTotals() {
        AggregationResult result = run(FilterChipSet.EMPTY, EntityDimension.AREA);

        assertEquals(8, result.globalTotals().contractCount());
        assertEquals(3020.0, result.globalTotals().totalValue(), 1e-9);
        long summed = result.rows().stream().mapToLong(AggregateRow::getContractCount).sum();
        assertEquals(8, summed);
    }

    @Test
    @DisplayName("Should compute global totals over the time range only, ignoring other filters")
    void testAggregate_ScanGlobalTotals() {
        FilterChipSet chips = year2020().toBuilder().keywords(List.of(ChipMatcher.parse("school"))).build();

        AggregationResult result = run(chips, EntityDimension.CONTRACTOR);

        assertEquals(1, result.rows().size());
        assertEquals(4, result.globalTotals().contractCount());
        assertEquals(1100.0, result.globalTotals().totalValue(), 1e-9);
    }

    @Test
    @DisplayName("Should count distinct counterparts per entity")
    void testAggregate_CounterpartCounts() {
        AggregateRow acme = byEntity(run(FilterChipSet.EMPTY, EntityDimension.CONTRACTOR)).get("ACME CORP");

        assertEquals(2, acme.counterpartCount(EntityDimension.ORGANIZATION));
        assertEquals(2, acme.counterpartCount(EntityDimension.AREA));
        assertEquals(2, acme.counterpartCount(EntityDimension.BUSINESS_CATEGORY));
        assertEquals(3, acme.getContractCount());
    }

    @Test
    @DisplayName("Should answer a degraded plan with the same rows")
    void testAggregate_DegradedPlan(@TempDir Path other) {
        Snapshot gappy = SnapshotFixture.store(SnapshotFixture.in(other).version("gappy")
                .withoutRollup(TimeBucket.year(2020), EntityDimension.CONTRACTOR)
                .write()).activate("gappy");

        AggregationResult degraded = run(gappy, year2020(), EntityDimension.CONTRACTOR);

        assertTrue(degraded.plan().degraded());
        assertSameRows(run(year2020(), EntityDimension.CONTRACTOR), degraded);
    }

    @Test
    @DisplayName("Should count only the requested years when another dataset year has no bucket")
    void testAggregate_MissingYearBucket(@TempDir Path other) {
        Snapshot gappy = SnapshotFixture.store(SnapshotFixture.in(other).version("gappy")
                .withoutBucket(TimeBucket.year(2019))
                .write()).activate("gappy");
        FilterChipSet chips = FilterChipSet.builder()
                .timeRanges(List.of(DateInterval.of("2020-01-01", "2021-12-31")))
                .build();

        AggregationResult rollup = run(gappy, chips, EntityDimension.CONTRACTOR);
        AggregationResult scan = run(gappy, chips.toBuilder().valueRange(new ValueRange(0.0, 1.0e12)).build(),
                EntityDimension.CONTRACTOR);

        assertTrue(rollup.plan().isRollup());
        assertEquals(750.0, byEntity(rollup).get("BETA BUILDERS").getTotalValue(), 1e-9);
        assertFalse(byEntity(rollup).containsKey("DELTA SERVICES"));
        assertEquals(6, rollup.globalTotals().contractCount());
        assertEquals(1900.0, rollup.globalTotals().totalValue(), 1e-9);
        assertSameRows(scan, rollup);
    }

    @Test
    @DisplayName("Should answer a whole year from its quarters when the year rollup is missing")
    void testAggregate_QuarterFallback(@TempDir Path other) {
        Snapshot gappy = SnapshotFixture.store(SnapshotFixture.in(other).version("gappy")
                .withoutRollup(TimeBucket.year(2020), EntityDimension.CONTRACTOR)
                .write()).activate("gappy");

        AggregationResult result = run(gappy, year2020(), EntityDimension.CONTRACTOR);

        assertEquals(PlanKind.MULTI_BUCKET_ROLLUP, result.plan().kind());
        AggregateRow acme = byEntity(result).get("ACME CORP");
        assertEquals(2, acme.getContractCount());
        assertEquals(300.0, acme.getTotalValue(), 1e-9);
        assertEquals(150.0, acme.getAverageValue(), 1e-9);
        assertEquals(4, result.globalTotals().contractCount());
    }

    @Test
    @DisplayName("Should fail when a rollup disagrees with the manifest")
    void testAggregate_Inconsistency(@TempDir Path other) {
        Snapshot corrupt = SnapshotFixture.store(SnapshotFixture.in(other).version("corrupt")
                .declareContracts(TimeBucket.year(2020), EntityDimension.CONTRACTOR, 3)
                .write()).activate("corrupt");

        assertThrows(InternalInconsistencyException.class, () -> run(corrupt, year2020(), EntityDimension.CONTRACTOR));
    }

    @Test
    @DisplayName("Should reject plans without a target dimension")
    void testAggregate_NoTarget() {
        QueryPlan raw = planner.plan(FilterChipSet.EMPTY, null, snapshot.getManifest());

        assertThrows(IllegalArgumentException.class, () -> aggregator.aggregate(snapshot, raw, FilterChipSet.EMPTY));
    }
}
