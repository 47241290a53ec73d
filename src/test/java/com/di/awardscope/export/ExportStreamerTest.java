package com.di.awardscope.export;

import com.di.awardscope.aggregate.Aggregator;
import com.di.awardscope.aggregate.FactScanner;
import com.di.awardscope.filter.ChipMatcher;
import com.di.awardscope.filter.DateInterval;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.pagination.Paginator;
import com.di.awardscope.pagination.RankRange;
import com.di.awardscope.pagination.SortSpec;
import com.di.awardscope.planner.QueryPlanner;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotFixture;
import com.di.awardscope.util.MetricsCollector;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ExportStreamer estimates, batching and cancellation.
 */
@DisplayName("ExportStreamer Tests")
class ExportStreamerTest {

    @TempDir
    Path root;

    private ExportProperties properties;
    private QueryPlanner planner;
    private ExportStreamer streamer;
    private Snapshot snapshot;

    @BeforeEach
    void setUp() {
        MetricsCollector metrics = SnapshotFixture.metrics();
        properties = new ExportProperties();
        properties.setBatchSize(2);
        planner = new QueryPlanner(metrics);
        FactScanner scanner = new FactScanner(metrics);
        streamer = new ExportStreamer(properties, scanner, new Aggregator(scanner), new Paginator(), metrics);
        snapshot = SnapshotFixture.store(SnapshotFixture.in(root).write(), metrics).current();
    }

    private ExportRequest request(FilterChipSet chips, EntityDimension target, RankRange range, ExportFormat format) {
        return new ExportRequest(snapshot, chips, planner.plan(chips, target, snapshot.getManifest()),
                SortSpec.DEFAULT, range, format);
    }

    private static List<String[]> parse(String text, char separator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        try (MappingIterator<String[]> it = new CsvMapper().readerForArrayOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(schema)
                .readValues(text)) {
            return it.readAll();
        }
    }

    private static FilterChipSet year2020() {
        return FilterChipSet.builder().timeRanges(List.of(DateInterval.ofYear(2020))).build();
    }

    // ============================================================================
    // Estimate = emitted rows
    // ============================================================================

    static Stream<FilterChipSet> rawFilters() {
        return Stream.of(
                FilterChipSet.EMPTY,
                year2020(),
                year2020().toBuilder().entityFilters(Map.of(EntityDimension.AREA, List.of(ChipMatcher.parse("MANILA")))).build(),
                year2020().toBuilder().keywords(List.of(ChipMatcher.parse("school"))).build(),
                FilterChipSet.builder().timeRanges(List.of(DateInterval.of("2020-02-01", "2021-03-31"))).build());
    }

    @ParameterizedTest
    @MethodSource("rawFilters")
    @DisplayName("Should estimate exactly the rows a raw export emits")
    void testEstimate_MatchesRawStream(FilterChipSet chips) {
        ExportRequest request = request(chips, null, null, ExportFormat.CSV);

        ExportEstimate estimate = streamer.estimate(request);
        long emitted = streamer.stream(request, new StringWriter(), new ExportJob("exp-test"), ExportProgressListener.NONE);

        assertEquals(estimate.rowCount(), emitted);
        assertTrue(estimate.byteEstimate() > 0);
    }

    @Test
    @DisplayName("Should estimate exactly the rows of an aggregated rank window")
    void testEstimate_MatchesAggregatedStream() {
        ExportRequest request = request(FilterChipSet.EMPTY, EntityDimension.CONTRACTOR, new RankRange(2, 10), ExportFormat.CSV);

        ExportEstimate estimate = streamer.estimate(request);
        long emitted = streamer.stream(request, new StringWriter(), new ExportJob("exp-test"), ExportProgressListener.NONE);

        assertEquals(3, estimate.rowCount());
        assertEquals(3, emitted);
    }

    // ============================================================================
    // Output
    // ============================================================================

    @Test
    @DisplayName("Should write the raw header and rows in file order")
    void testStream_RawRows() throws IOException {
        FilterChipSet chips = year2020().toBuilder()
                .entityFilters(Map.of(EntityDimension.CONTRACTOR, List.of(ChipMatcher.parse("ACME CORP"))))
                .build();
        StringWriter out = new StringWriter();

        streamer.stream(request(chips, null, null, ExportFormat.CSV), out, new ExportJob("exp-test"), ExportProgressListener.NONE);

        List<String[]> lines = parse(out.toString(), ',');
        assertEquals(3, lines.size());
        assertEquals(ExportColumns.RAW, Arrays.asList(lines.get(0)));
        assertEquals(List.of("R001", "C-R001", "Medical supplies", "Notice for Medical supplies", "ACME CORP",
                "DEPT OF HEALTH", "MANILA", "GOODS", "100", "2020-02-10"), Arrays.asList(lines.get(1)));
        assertEquals("R002", lines.get(2)[0]);
    }

    @Test
    @DisplayName("Should write ranked aggregated rows as TSV")
    void testStream_AggregatedTsv() throws IOException {
        StringWriter out = new StringWriter();

        streamer.stream(request(year2020(), EntityDimension.CONTRACTOR, null, ExportFormat.TSV), out,
                new ExportJob("exp-test"), ExportProgressListener.NONE);

        assertTrue(out.toString().startsWith("rank\tcontractor\tcontract_count\t"));
        List<String[]> lines = parse(out.toString(), '\t');
        assertEquals(ExportColumns.header(EntityDimension.CONTRACTOR), Arrays.asList(lines.get(0)));
        assertEquals(List.of("1", "BETA BUILDERS", "1", "750", "750", "2020-11-20", "2020-11-20", "1", "1", "1"),
                Arrays.asList(lines.get(1)));
        assertEquals(List.of("2", "ACME CORP", "2", "300", "150", "2020-02-10", "2020-08-05", "2", "2", "1"),
                Arrays.asList(lines.get(2)));
    }

    @Test
    @DisplayName("Should write only the header when nothing matches")
    void testStream_EmptyResult() throws IOException {
        FilterChipSet chips = FilterChipSet.builder().keywords(List.of(ChipMatcher.parse("no such award"))).build();
        StringWriter out = new StringWriter();

        long emitted = streamer.stream(request(chips, null, null, ExportFormat.CSV), out, new ExportJob("exp-test"),
                ExportProgressListener.NONE);

        assertEquals(0, emitted);
        assertEquals(1, parse(out.toString(), ',').size());
    }

    // ============================================================================
    // Progress and cancellation
    // ============================================================================

    @Test
    @DisplayName("Should report progress after every batch and complete the job")
    void testStream_Progress() {
        ExportJob job = new ExportJob("exp-test");
        ExportRequest request = request(FilterChipSet.EMPTY, null, null, ExportFormat.CSV);
        job.setEstimatedRows(streamer.estimate(request).rowCount());
        List<Long> progress = new ArrayList<>();

        streamer.stream(request, new StringWriter(), job, (j, rows, estimated) -> progress.add(rows));

        assertEquals(List.of(2L, 4L, 6L, 8L), progress);
        assertEquals(ExportJobState.COMPLETED, job.getState());
        assertEquals(1.0, job.status().progress(), 1e-9);
    }

    @Test
    @DisplayName("Should stop at the next batch boundary once cancelled")
    void testStream_CancelAtBatchBoundary() throws IOException {
        ExportJob job = new ExportJob("exp-test");
        StringWriter out = new StringWriter();

        ExportCancelledException e = assertThrows(ExportCancelledException.class,
                () -> streamer.stream(request(FilterChipSet.EMPTY, null, null, ExportFormat.CSV), out, job,
                        (j, rows, estimated) -> j.cancel()));

        assertEquals(2, e.getRowsEmitted());
        assertEquals(2, job.getRowsEmitted());
        assertEquals(ExportJobState.CANCELLED, job.getState());
        assertEquals(3, parse(out.toString(), ',').size());
    }

    @Test
    @DisplayName("Should cancel the job when the sink fails")
    void testStream_SinkFailure() {
        ExportJob job = new ExportJob("exp-test");
        Writer broken = new Writer() {
            private int written;

            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                written += len;
                if (written > 200) {
                    throw new IOException("Broken pipe");
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        ExportCancelledException e = assertThrows(ExportCancelledException.class,
                () -> streamer.stream(request(FilterChipSet.EMPTY, null, null, ExportFormat.CSV), broken, job,
                        ExportProgressListener.NONE));

        assertEquals(ExportJobState.CANCELLED, job.getState());
        assertInstanceOf(IOException.class, e.getCause());
    }
}
