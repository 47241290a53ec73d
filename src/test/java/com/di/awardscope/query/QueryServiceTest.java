package com.di.awardscope.query;

import com.di.awardscope.aggregate.Aggregator;
import com.di.awardscope.aggregate.ChartAggregates;
import com.di.awardscope.aggregate.ChartAggregator;
import com.di.awardscope.aggregate.FactScanner;
import com.di.awardscope.aggregate.ValueDistribution;
import com.di.awardscope.export.ExportEstimate;
import com.di.awardscope.export.ExportJob;
import com.di.awardscope.export.ExportProperties;
import com.di.awardscope.export.ExportRequest;
import com.di.awardscope.export.ExportStreamer;
import com.di.awardscope.filter.FilterNormalizer;
import com.di.awardscope.filter.FilterValidationException;
import com.di.awardscope.filter.RawFilterRequest;
import com.di.awardscope.filter.RawTimeRange;
import com.di.awardscope.pagination.Paginator;
import com.di.awardscope.pagination.RankedAggregate;
import com.di.awardscope.planner.PlanKind;
import com.di.awardscope.planner.QueryPlanner;
import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.InternalInconsistencyException;
import com.di.awardscope.snapshot.SnapshotFixture;
import com.di.awardscope.snapshot.SnapshotStore;
import com.di.awardscope.snapshot.TimeBucket;
import com.di.awardscope.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for QueryService: boundary validation, dispatch and the wall-clock budget.
 */
@DisplayName("QueryService Tests")
class QueryServiceTest {

    @TempDir
    Path root;

    private SimpleMeterRegistry registry;
    private QueryProperties properties;
    private ExecutorService executor;
    private QueryService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new QueryProperties();
        properties.setTimeoutMs(10_000);
        executor = Executors.newFixedThreadPool(2);
        MetricsCollector metrics = new MetricsCollector(registry);
        service = service(SnapshotFixture.store(SnapshotFixture.in(root).write(), metrics), metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QueryService service(SnapshotStore store, MetricsCollector metrics) {
        FactScanner scanner = new FactScanner(metrics);
        Aggregator aggregator = new Aggregator(scanner);
        Paginator paginator = new Paginator();
        ExportStreamer streamer = new ExportStreamer(new ExportProperties(), scanner, aggregator, paginator, metrics);
        return new QueryService(store, new FilterNormalizer(), new QueryPlanner(metrics), aggregator,
                new ChartAggregator(scanner), scanner, paginator, streamer, properties, executor, metrics);
    }

    private static RawFilterRequest year(int year) {
        return RawFilterRequest.builder().timeRanges(List.of(RawTimeRange.yearly(year))).build();
    }

    // ============================================================================
    // search
    // ============================================================================

    @Test
    @DisplayName("Should return raw facts by amount descending without a target dimension")
    void testSearch_RawFacts() {
        SearchResult result = service.search(SearchQuery.builder().limit(3).build());

        List<String> refs = result.rows().stream()
                .map(r -> ((ContractFact) r).getReferenceId())
                .collect(Collectors.toList());
        assertEquals(List.of("R004", "R005", "R003"), refs);
        assertEquals(8, result.totalCount());
        assertTrue(result.hasNext());
        assertEquals(PlanKind.FACT_SCAN, result.planKind());
        assertEquals("v1", result.snapshotVersion());
    }

    @Test
    @DisplayName("Should page ranked aggregates for a target dimension")
    void testSearch_Aggregated() {
        SearchResult result = service.search(SearchQuery.builder()
                .filters(year(2020)).targetDimension("contractor").offset(1).limit(1).build());

        RankedAggregate row = (RankedAggregate) result.rows().get(0);
        assertEquals(2, row.rank());
        assertEquals("ACME CORP", row.row().getEntity());
        assertEquals(3, result.totalCount());
        assertTrue(result.hasNext());
        assertEquals(PlanKind.SINGLE_BUCKET_ROLLUP, result.planKind());
    }

    @Test
    @DisplayName("Should reject windows outside the configured bounds")
    void testSearch_WindowValidation() {
        properties.setMaxRawWindow(100);

        assertThrows(FilterValidationException.class, () -> service.search(SearchQuery.builder().offset(-1).build()));
        assertThrows(FilterValidationException.class, () -> service.search(SearchQuery.builder().limit(0).build()));
        assertThrows(FilterValidationException.class,
                () -> service.search(SearchQuery.builder().limit(properties.getMaxPageSize() + 1).build()));
        FilterValidationException e = assertThrows(FilterValidationException.class,
                () -> service.search(SearchQuery.builder().offset(90).limit(20).build()));
        assertEquals("offset", e.getField());
        // aggregated search has no raw window
        assertDoesNotThrow(() -> service.search(SearchQuery.builder()
                .targetDimension("area").offset(90).limit(20).build()));
    }

    @Test
    @DisplayName("Should reject an unknown target dimension")
    void testSearch_UnknownDimension() {
        FilterValidationException e = assertThrows(FilterValidationException.class,
                () -> service.search(SearchQuery.builder().targetDimension("supplier").build()));

        assertEquals("target_dimension", e.getField());
    }

    // ============================================================================
    // charts
    // ============================================================================

    @Test
    @DisplayName("Should build chart aggregates from a fact scan of the filtered facts")
    void testCharts_Filtered() {
        ChartResult<ChartAggregates> result = service.charts(ChartQuery.builder().filters(year(2021)).topN(1).build());

        assertEquals(PlanKind.FACT_SCAN, result.planKind());
        assertEquals(2, result.data().summary().contractCount());
        assertEquals(800.0, result.data().summary().totalValue(), 1e-9);
        assertEquals(1, result.data().byContractor().size());
        assertEquals("ACME CORP", result.data().byContractor().get(0).label());
        assertEquals(SnapshotFixture.VERSION, result.snapshotVersion());
    }

    @Test
    @DisplayName("Should default top N and bins and reject values outside their limits")
    void testCharts_Limits() {
        assertEquals(4, service.charts(new ChartQuery()).data().byContractor().size());
        assertEquals(properties.getDefaultBins(), service.valueDistribution(new DistributionQuery()).data().numBins());

        FilterValidationException topN = assertThrows(FilterValidationException.class,
                () -> service.charts(ChartQuery.builder().topN(0).build()));
        assertEquals("top_n", topN.getField());
        FilterValidationException bins = assertThrows(FilterValidationException.class,
                () -> service.valueDistribution(DistributionQuery.builder().numBins(properties.getMaxBins() + 1).build()));
        assertEquals("num_bins", bins.getField());
    }

    @Test
    @DisplayName("Should compute the value distribution of the filtered facts")
    void testValueDistribution() {
        ValueDistribution result = service.valueDistribution(
                DistributionQuery.builder().filters(year(2020)).numBins(2).build()).data();

        assertEquals(50.0, result.minValue(), 1e-9);
        assertEquals(750.0, result.maxValue(), 1e-9);
        assertEquals(350.0, result.binWidth(), 1e-9);
        assertEquals(4, result.totalContracts());
        assertEquals(2, result.bins().size());
        assertEquals(3, result.bins().get(0).count());
        assertEquals(350.0, result.bins().get(0).totalValue(), 1e-9);
        assertEquals(750.0, result.bins().get(1).totalValue(), 1e-9);
    }

    // ============================================================================
    // aggregate
    // ============================================================================

    @Test
    @DisplayName("Should aggregate the first default-limit ranks with global totals")
    void testAggregate_DefaultRange() {
        AggregateResult result = service.aggregate(AggregateQuery.builder().targetDimension("contractor").build());

        assertEquals(List.of("BETA BUILDERS", "ACME CORP", "GAMMA TRADING", "DELTA SERVICES"),
                result.rows().stream().map(r -> r.row().getEntity()).collect(Collectors.toList()));
        assertEquals(1, result.rankFrom());
        assertEquals(properties.getDefaultLimit(), result.rankTo());
        assertEquals(8, result.globalTotals().contractCount());
        assertEquals(3020.0, result.globalTotals().totalValue(), 1e-9);
        assertFalse(result.degraded());
    }

    @Test
    @DisplayName("Should return the requested rank window")
    void testAggregate_RankWindow() {
        AggregateResult result = service.aggregate(AggregateQuery.builder()
                .targetDimension("by_area").sort(new SortRequest("contract_count", "desc")).rankFrom(2).rankTo(3).build());

        assertEquals(List.of(2, 3), result.rows().stream().map(RankedAggregate::rank).collect(Collectors.toList()));
        assertEquals(3, result.totalCount());
    }

    @Test
    @DisplayName("Should reject missing targets and inverted rank ranges")
    void testAggregate_Validation() {
        assertThrows(FilterValidationException.class, () -> service.aggregate(new AggregateQuery()));
        FilterValidationException e = assertThrows(FilterValidationException.class,
                () -> service.aggregate(AggregateQuery.builder().targetDimension("contractor").rankFrom(5).rankTo(4).build()));
        assertEquals("rank_to", e.getField());
        assertThrows(FilterValidationException.class,
                () -> service.aggregate(AggregateQuery.builder().targetDimension("contractor").rankFrom(0).build()));
        properties.setMaxRankWindow(10);
        assertThrows(FilterValidationException.class,
                () -> service.aggregate(AggregateQuery.builder().targetDimension("contractor").rankFrom(1).rankTo(11).build()));
    }

    @Test
    @DisplayName("Should count corrupt snapshot data and propagate the inconsistency")
    void testAggregate_Inconsistency(@TempDir Path other) {
        MetricsCollector metrics = new MetricsCollector(registry);
        SnapshotStore store = SnapshotFixture.store(SnapshotFixture.in(other).version("corrupt")
                .declareContracts(TimeBucket.year(2020), EntityDimension.CONTRACTOR, 3)
                .write(), metrics);
        store.activate("corrupt");
        QueryService corrupt = service(store, metrics);

        assertThrows(InternalInconsistencyException.class, () -> corrupt.aggregate(AggregateQuery.builder()
                .filters(year(2020)).targetDimension("contractor").build()));
        assertEquals(1.0, registry.find("awardscope.snapshot.inconsistencies").counter().count());
        assertEquals(1.0, registry.find("awardscope.query.errors").counter().count());
    }

    // ============================================================================
    // export
    // ============================================================================

    @Test
    @DisplayName("Should reject rank ranges and bad formats before any output")
    void testPrepareExport_Validation() {
        assertThrows(FilterValidationException.class, () -> service.prepareExport(ExportQuery.builder().rankFrom(1).build()));
        FilterValidationException e = assertThrows(FilterValidationException.class,
                () -> service.prepareExport(ExportQuery.builder().format("xlsx").build()));
        assertEquals("format", e.getField());
    }

    @Test
    @DisplayName("Should fill the job's estimate and stream the export")
    void testExport_EstimateThenStream() {
        ExportQuery query = ExportQuery.builder()
                .filters(RawFilterRequest.builder().entityFilters(Map.of("area", List.of("MANILA"))).build())
                .build();
        ExportEstimate estimate = service.estimateExport(query);
        ExportRequest request = service.prepareExport(query);
        ExportJob job = new ExportJob("exp-query");
        StringWriter out = new StringWriter();

        long rows = service.export(request, out, job, null);

        assertEquals(4, estimate.rowCount());
        assertEquals(4, rows);
        assertEquals(4, job.getEstimatedRows());
        assertEquals(5, out.toString().split("\n").length);
    }

    // ============================================================================
    // Wall-clock budget
    // ============================================================================

    @Test
    @DisplayName("Should time out and interrupt work past the budget")
    void testRunWithBudget_Timeout() {
        properties.setTimeoutMs(50);

        QueryTimeoutException e = assertThrows(QueryTimeoutException.class, () -> service.runWithBudget("slow", () -> {
            Thread.sleep(5_000);
            return "late";
        }));

        assertEquals("slow", e.getOperation());
        assertEquals(50, e.getTimeoutMs());
        assertEquals(1.0, registry.find("awardscope.query.timeouts").counter().count());
    }

    @Test
    @DisplayName("Should rethrow runtime failures of the worker unchanged")
    void testRunWithBudget_RuntimeFailure() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> service.runWithBudget("failing", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("boom", e.getMessage());
    }

    @Test
    @DisplayName("Should wrap checked failures of the worker")
    void testRunWithBudget_CheckedFailure() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> service.runWithBudget("checked", () -> {
            throw new IOException("disk");
        }));

        assertInstanceOf(IOException.class, e.getCause());
    }
}
