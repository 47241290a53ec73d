package com.di.awardscope.export;

import com.di.awardscope.aggregate.AggregationResult;
import com.di.awardscope.aggregate.Aggregator;
import com.di.awardscope.aggregate.FactScanner;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.pagination.Paginator;
import com.di.awardscope.pagination.RankedAggregate;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.EntityRollupRow;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotManifest;
import com.di.awardscope.snapshot.TimeBucket;
import com.di.awardscope.util.MetricsCollector;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Export in two independent operations over the same {@link ExportRequest}:
 * <ul>
 *   <li>{@link #estimate}: exact row count plus a byte estimate, without producing text</li>
 *   <li>{@link #stream}: header plus fixed-size batches of delimited text written to a sink</li>
 * </ul>
 * Between batches the stream flushes the sink, reports progress and honours cancellation. Only
 * one batch of rows is buffered at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportStreamer {

    private static final CsvMapper CSV = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private final ExportProperties properties;
    private final FactScanner factScanner;
    private final Aggregator aggregator;
    private final Paginator paginator;
    private final MetricsCollector metricsCollector;

    /* ------------------------------------------------------------------ */
    /* Estimate                                                             */
    /* ------------------------------------------------------------------ */

    public ExportEstimate estimate(ExportRequest request) {
        long rows = request.isAggregated() ? countAggregated(request) : countRaw(request);
        int width = request.isAggregated() ? properties.getAggregatedRowBytes() : properties.getRawRowBytes();
        long bytes = ExportColumns.headerBytes(request.plan().targetDimension(), request.format()) + rows * width;
        log.info("[EXPORT] Estimate: {} rows, ~{} bytes ({})", rows, bytes, request.plan().kind());
        return new ExportEstimate(rows, bytes);
    }

    private long countAggregated(ExportRequest request) {
        AggregationResult result = aggregator.aggregate(request.snapshot(), request.plan(), request.chips());
        return Paginator.windowSize(result.rows().size(), request.rankRange());
    }

    /**
     * Raw row count. Uses manifest fact counts when only whole buckets constrain the rows, rollup
     * contract counts when additionally one dimension is filtered, and a counting scan otherwise.
     */
    private long countRaw(ExportRequest request) {
        QueryPlan plan = request.plan();
        FilterChipSet chips = request.chips();
        SnapshotManifest manifest = request.snapshot().getManifest();
        if (plan.isTimeAligned() && chips.isTimeOnly()) {
            long total = 0;
            boolean complete = true;
            for (TimeBucket bucket : plan.timeCover()) {
                SnapshotManifest.BucketEntry entry = manifest.find(bucket).orElse(null);
                if (entry == null || !entry.hasFacts()) {
                    complete = false;
                    break;
                }
                total += entry.getFactRows();
            }
            if (complete) {
                log.debug("[EXPORT] Raw count from manifest fact rows of {}", plan.timeCover());
                return total;
            }
        }
        Set<EntityDimension> dims = chips.filteredDimensions();
        if (plan.isTimeAligned() && dims.size() == 1 && !chips.hasKeywords()
                && !chips.getValueRange().isActive() && !chips.isIncludeSecondaryDataset()) {
            EntityDimension dim = dims.iterator().next();
            boolean available = plan.timeCover().stream().allMatch(b -> manifest.hasRollup(b, dim));
            if (available) {
                long total = 0;
                for (TimeBucket bucket : plan.timeCover()) {
                    for (EntityRollupRow row : request.snapshot().rollup(bucket, dim).rows()) {
                        if (chips.matchesEntity(dim, row.getEntity())) {
                            total += row.getContractCount();
                        }
                    }
                }
                log.debug("[EXPORT] Raw count from {} rollup contract counts of {}", dim.getKey(), plan.timeCover());
                return total;
            }
        }
        return factScanner.count(request.snapshot(), plan, chips);
    }

    /* ------------------------------------------------------------------ */
    /* Stream                                                               */
    /* ------------------------------------------------------------------ */

    /**
     * Writes the export to {@code sink}. Raw exports follow snapshot file order, aggregated ones the
     * paginator's order. Does not close the sink.
     *
     * @return rows written, header excluded
     * @throws ExportCancelledException when the job was cancelled or the sink failed; the output is partial
     */
    public long stream(ExportRequest request, Writer sink, ExportJob job, ExportProgressListener listener) {
        EntityDimension dim = request.plan().targetDimension();
        List<String> columns = ExportColumns.header(dim);
        ObjectWriter writer = CSV.writerFor(Map.class).with(schema(columns, request.format()));
        log.info("[EXPORT] Job {} started: {} {} (estimated {} rows)", job.getId(),
                dim != null ? dim.getKey() : "raw", request.format().getKey(), job.getEstimatedRows());
        try (SequenceWriter out = writer.writeValues(sink)) {
            long written;
            if (dim == null) {
                try (FactScanner.MatchingFacts facts = factScanner.open(request.snapshot(), request.plan(), request.chips())) {
                    written = writeBatches(facts, ExportColumns::rawRow, columns, out, sink, job, listener);
                }
            } else {
                AggregationResult result = aggregator.aggregate(request.snapshot(), request.plan(), request.chips());
                Iterator<RankedAggregate> ranked = paginator.rankedSequence(result.rows(), request.sort(), request.rankRange());
                written = writeBatches(ranked, r -> ExportColumns.aggregatedRow(r, dim), columns, out, sink, job, listener);
            }
            job.complete();
            metricsCollector.recordExportCompleted();
            log.info("[EXPORT] Job {} completed: {} rows", job.getId(), written);
            return written;
        } catch (IOException e) {
            job.cancelled();
            metricsCollector.recordExportCancelled();
            log.info("[EXPORT] Job {} stopped after {} rows: sink failed ({})", job.getId(), job.getRowsEmitted(), e.getMessage());
            throw new ExportCancelledException(job.getId(), job.getRowsEmitted(), "client disconnected", e);
        } catch (ExportCancelledException e) {
            metricsCollector.recordExportCancelled();
            throw e;
        } catch (RuntimeException e) {
            job.failed(e.getMessage());
            metricsCollector.recordExportFailed();
            throw e;
        }
    }

    private <T> long writeBatches(Iterator<T> rows, Function<T, Map<String, String>> toRow, List<String> columns,
                                  SequenceWriter out, Writer sink, ExportJob job,
                                  ExportProgressListener listener) throws IOException {
        int batchSize = Math.max(1, properties.getBatchSize());
        List<Map<String, String>> batch = new ArrayList<>(Math.min(batchSize, 4096));
        boolean headerWritten = false;
        long written = 0;
        while (rows.hasNext()) {
            if (job.isCancelRequested()) {
                job.cancelled();
                log.info("[EXPORT] Job {} cancelled at batch boundary after {} rows", job.getId(), written);
                throw new ExportCancelledException(job.getId(), written, "cancelled");
            }
            batch.clear();
            while (batch.size() < batchSize && rows.hasNext()) {
                batch.add(toRow.apply(rows.next()));
            }
            if (!headerWritten) {
                out.write(ExportColumns.headerRow(columns));
                headerWritten = true;
            }
            for (Map<String, String> row : batch) {
                out.write(row);
            }
            out.flush();
            sink.flush();
            written += batch.size();
            job.advance(batch.size());
            metricsCollector.recordExportRows(batch.size());
            listener.onBatch(job, written, job.getEstimatedRows());
        }
        if (!headerWritten) {
            out.write(ExportColumns.headerRow(columns));
            out.flush();
            sink.flush();
        }
        return written;
    }

    private static CsvSchema schema(List<String> columns, ExportFormat format) {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String c : columns) {
            b.addColumn(c);
        }
        return b.setUseHeader(false)
                .setColumnSeparator(format.getSeparator())
                .setLineSeparator("\n")
                .build();
    }
}
