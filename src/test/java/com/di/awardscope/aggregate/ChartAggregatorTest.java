package com.di.awardscope.aggregate;

import com.di.awardscope.aggregate.ChartAggregates.LabelTotal;
import com.di.awardscope.aggregate.ChartAggregates.YearTotal;
import com.di.awardscope.filter.ChipMatcher;
import com.di.awardscope.filter.DateInterval;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.planner.QueryPlanner;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotFixture;
import com.di.awardscope.util.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ChartAggregator: chart series, top lists and the value histogram.
 */
@DisplayName("ChartAggregator Tests")
class ChartAggregatorTest {

    @TempDir
    Path root;

    private QueryPlanner planner;
    private ChartAggregator charts;
    private Snapshot snapshot;

    @BeforeEach
    void setUp() {
        MetricsCollector metrics = SnapshotFixture.metrics();
        planner = new QueryPlanner(metrics);
        charts = new ChartAggregator(new FactScanner(metrics));
        snapshot = SnapshotFixture.store(SnapshotFixture.in(root).write(), metrics).current();
    }

    private ChartAggregates charts(FilterChipSet chips, int topN) {
        QueryPlan plan = planner.plan(chips, null, snapshot.getManifest());
        return charts.charts(snapshot, plan, chips, topN);
    }

    private ValueDistribution distribution(Snapshot s, FilterChipSet chips, int bins) {
        QueryPlan plan = planner.plan(chips, null, s.getManifest());
        return charts.valueDistribution(s, plan, chips, bins);
    }

    private static List<String> labels(List<LabelTotal> rows) {
        return rows.stream().map(LabelTotal::label).collect(Collectors.toList());
    }

    // ============================================================================
    // Chart aggregates
    // ============================================================================

    @Test
    @DisplayName("Should summarize all facts and group them by year and month")
    void testCharts_Series() {
        ChartAggregates result = charts(FilterChipSet.EMPTY, 20);

        assertEquals(8, result.summary().contractCount());
        assertEquals(3020.0, result.summary().totalValue(), 1e-9);
        assertEquals(377.5, result.summary().averageValue(), 1e-9);
        assertEquals(List.of(
                new YearTotal(2019, 1120.0, 2),
                new YearTotal(2020, 1100.0, 4),
                new YearTotal(2021, 800.0, 2)), result.byYear());
        assertEquals(8, result.byMonth().size());
        assertEquals("2019-01", result.byMonth().get(0).month());
        assertEquals("2021-12", result.byMonth().get(7).month());
        assertEquals(750.0, result.byMonth().stream()
                .filter(m -> m.month().equals("2020-11")).findFirst().orElseThrow().totalValue(), 1e-9);
    }

    @Test
    @DisplayName("Should rank every dimension by total value and keep the top N")
    void testCharts_TopLists() {
        ChartAggregates result = charts(FilterChipSet.EMPTY, 2);

        assertEquals(List.of("BETA BUILDERS", "ACME CORP"), labels(result.byContractor()));
        assertEquals(new LabelTotal("BETA BUILDERS", 1750.0, 2), result.byContractor().get(0));
        assertEquals(List.of("DEPT OF HEALTH", "DEPT OF PUBLIC WORKS"), labels(result.byOrganization()));
        assertEquals(List.of("MANILA", "DAVAO"), labels(result.byArea()));
        assertEquals(List.of("INFRASTRUCTURE", "CONSULTING"), labels(result.byCategory()));
    }

    @Test
    @DisplayName("Should aggregate only the facts matching the chips")
    void testCharts_Filtered() {
        FilterChipSet chips = FilterChipSet.builder()
                .timeRanges(List.of(DateInterval.ofYear(2020)))
                .build();

        ChartAggregates result = charts(chips, 20);

        assertEquals(4, result.summary().contractCount());
        assertEquals(1100.0, result.summary().totalValue(), 1e-9);
        assertEquals(List.of(new YearTotal(2020, 1100.0, 4)), result.byYear());
        assertEquals(List.of("BETA BUILDERS", "ACME CORP", "GAMMA TRADING"), labels(result.byContractor()));
    }

    @Test
    @DisplayName("Should return zero totals and empty series when nothing matches")
    void testCharts_NoMatch() {
        FilterChipSet chips = FilterChipSet.builder().keywords(List.of(ChipMatcher.parse("submarine"))).build();

        ChartAggregates result = charts(chips, 20);

        assertEquals(GlobalTotals.EMPTY, result.summary());
        assertTrue(result.byYear().isEmpty());
        assertTrue(result.byMonth().isEmpty());
        assertTrue(result.byContractor().isEmpty());
    }

    // ============================================================================
    // Value distribution
    // ============================================================================

    @Test
    @DisplayName("Should bin positive amounts between min and max and list only non-empty bins")
    void testDistribution_Bins() {
        ValueDistribution result = distribution(snapshot, FilterChipSet.EMPTY, 10);

        assertEquals(50.0, result.minValue(), 1e-9);
        assertEquals(1000.0, result.maxValue(), 1e-9);
        assertEquals(95.0, result.binWidth(), 1e-9);
        assertEquals(8, result.totalContracts());
        assertEquals(List.of(1, 2, 3, 5, 8, 10),
                result.bins().stream().map(ValueDistribution.Bin::binNumber).collect(Collectors.toList()));

        ValueDistribution.Bin first = result.bins().get(0);
        assertEquals(3, first.count());
        assertEquals(270.0, first.totalValue(), 1e-9);
        assertEquals(50.0, first.binStart(), 1e-9);
        assertEquals(145.0, first.binEnd(), 1e-9);
        assertEquals(1, result.bins().get(5).count());
        assertEquals(8, result.bins().stream().mapToLong(ValueDistribution.Bin::count).sum());
    }

    @Test
    @DisplayName("Should place the maximum amount in the last bin")
    void testDistribution_BinOf() {
        assertEquals(1, ChartAggregator.binOf(50.0, 50.0, 95.0, 10));
        assertEquals(2, ChartAggregator.binOf(145.0, 50.0, 95.0, 10));
        assertEquals(10, ChartAggregator.binOf(1000.0, 50.0, 95.0, 10));
        assertEquals(1, ChartAggregator.binOf(70.0, 70.0, 0.0, 10));
    }

    @Test
    @DisplayName("Should put equal amounts in the first bin")
    void testDistribution_SingleValue(@TempDir Path other) {
        Snapshot flat = SnapshotFixture.store(SnapshotFixture.in(other).version("flat")
                .facts(List.of(
                        SnapshotFixture.fact("F001", "ACME CORP", "DEPT OF HEALTH", "MANILA", "GOODS", 70, "2020-02-10", "Gloves"),
                        SnapshotFixture.fact("F002", "BETA BUILDERS", "DEPT OF HEALTH", "MANILA", "GOODS", 70, "2020-03-10", "Masks")))
                .write()).activate("flat");

        ValueDistribution result = distribution(flat, FilterChipSet.EMPTY, 5);

        assertEquals(0.0, result.binWidth(), 1e-9);
        assertEquals(1, result.bins().size());
        assertEquals(2, result.bins().get(0).count());
        assertEquals(140.0, result.bins().get(0).totalValue(), 1e-9);
    }

    @Test
    @DisplayName("Should return zeros and no bins when nothing matches")
    void testDistribution_NoMatch() {
        FilterChipSet chips = FilterChipSet.builder().keywords(List.of(ChipMatcher.parse("submarine"))).build();

        ValueDistribution result = distribution(snapshot, chips, 10);

        assertEquals(0, result.totalContracts());
        assertEquals(0.0, result.minValue(), 1e-9);
        assertEquals(0.0, result.maxValue(), 1e-9);
        assertTrue(result.bins().isEmpty());
    }
}
