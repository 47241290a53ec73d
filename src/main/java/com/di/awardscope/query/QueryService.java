package com.di.awardscope.query;

import com.di.awardscope.aggregate.AggregationResult;
import com.di.awardscope.aggregate.Aggregator;
import com.di.awardscope.aggregate.ChartAggregates;
import com.di.awardscope.aggregate.ChartAggregator;
import com.di.awardscope.aggregate.FactScanner;
import com.di.awardscope.aggregate.ValueDistribution;
import com.di.awardscope.export.ExportEstimate;
import com.di.awardscope.export.ExportFormat;
import com.di.awardscope.export.ExportJob;
import com.di.awardscope.export.ExportProgressListener;
import com.di.awardscope.export.ExportRequest;
import com.di.awardscope.export.ExportStreamer;
import com.di.awardscope.filter.DatasetBounds;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.filter.FilterNormalizer;
import com.di.awardscope.filter.FilterValidationException;
import com.di.awardscope.filter.RawFilterRequest;
import com.di.awardscope.pagination.Page;
import com.di.awardscope.pagination.Paginator;
import com.di.awardscope.pagination.RankRange;
import com.di.awardscope.pagination.RankedAggregate;
import com.di.awardscope.pagination.SortSpec;
import com.di.awardscope.pagination.TopFacts;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.planner.QueryPlanner;
import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.FilterOptions;
import com.di.awardscope.snapshot.InternalInconsistencyException;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotStore;
import com.di.awardscope.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.Writer;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the query engine. Each operation validates and normalizes its input once, captures
 * the current snapshot, plans and runs. Everything except the export stream itself runs on the query-worker pool under the configured wall-clock budget;
 * exports run on the caller's thread without a budget and stop only on cancellation.
 */
@Slf4j
@Service
public class QueryService {

    private final SnapshotStore snapshotStore;
    private final FilterNormalizer filterNormalizer;
    private final QueryPlanner queryPlanner;
    private final Aggregator aggregator;
    private final ChartAggregator chartAggregator;
    private final FactScanner factScanner;
    private final Paginator paginator;
    private final ExportStreamer exportStreamer;
    private final QueryProperties properties;
    private final ExecutorService queryExecutor;
    private final MetricsCollector metricsCollector;

    public QueryService(SnapshotStore snapshotStore,
                        FilterNormalizer filterNormalizer,
                        QueryPlanner queryPlanner,
                        Aggregator aggregator,
                        ChartAggregator chartAggregator,
                        FactScanner factScanner,
                        Paginator paginator,
                        ExportStreamer exportStreamer,
                        QueryProperties properties,
                        @Qualifier("queryExecutor") ExecutorService queryExecutor,
                        MetricsCollector metricsCollector) {
        this.snapshotStore = snapshotStore;
        this.filterNormalizer = filterNormalizer;
        this.queryPlanner = queryPlanner;
        this.aggregator = aggregator;
        this.chartAggregator = chartAggregator;
        this.factScanner = factScanner;
        this.paginator = paginator;
        this.exportStreamer = exportStreamer;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
        this.metricsCollector = metricsCollector;
    }

    /* ------------------------------------------------------------------ */
    /* search                                                               */
    /* ------------------------------------------------------------------ */

    /**
     * Raw facts (amount desc, reference id asc) when no target dimension is given, otherwise ranked
     * aggregates of that dimension.
     */
    public SearchResult search(SearchQuery query) {
        int offset = query.getOffset() != null ? query.getOffset() : 0;
        int limit = query.getLimit() != null ? query.getLimit() : properties.getDefaultLimit();
        checkWindow(offset, limit);
        QueryRequest request = prepare(query.getFilters(), query.getTargetDimension(), sort(query.getSort()));
        if (request.target() == null && (long) offset + limit > properties.getMaxRawWindow()) {
            throw new FilterValidationException("offset", offset,
                    "offset + limit must not exceed " + properties.getMaxRawWindow() + " for raw fact search");
        }
        return runWithBudget("search", () -> {
            Snapshot snapshot = request.snapshot();
            QueryPlan plan = queryPlanner.plan(request.chips(), request.target(), snapshot.getManifest());
            if (request.target() == null) {
                TopFacts top = new TopFacts(offset + limit);
                factScanner.scan(snapshot, plan, request.chips(), top::offer);
                Page<ContractFact> page = top.page(offset, limit);
                return new SearchResult(page.rows(), page.totalCount(), offset, limit, page.hasNext(),
                        plan.kind(), plan.degraded(), snapshot.getVersion());
            }
            AggregationResult result = aggregator.aggregate(snapshot, plan, request.chips());
            Page<RankedAggregate> page = paginator.page(result.rows(), request.sort(), offset, limit);
            return new SearchResult(page.rows(), page.totalCount(), offset, limit, page.hasNext(),
                    plan.kind(), plan.degraded(), snapshot.getVersion());
        });
    }

    /* ------------------------------------------------------------------ */
    /* aggregate                                                            */
    /* ------------------------------------------------------------------ */

    public AggregateResult aggregate(AggregateQuery query) {
        if (query.getTargetDimension() == null || query.getTargetDimension().isBlank()) {
            throw new FilterValidationException("target_dimension", null, "required for aggregate");
        }
        RankRange range = rankRange(query.getRankFrom(), query.getRankTo(), true);
        QueryRequest request = prepare(query.getFilters(), query.getTargetDimension(), sort(query.getSort()));
        return runWithBudget("aggregate", () -> {
            Snapshot snapshot = request.snapshot();
            QueryPlan plan = queryPlanner.plan(request.chips(), request.target(), snapshot.getManifest());
            AggregationResult result = aggregator.aggregate(snapshot, plan, request.chips());
            Page<RankedAggregate> page = paginator.rankRange(result.rows(), request.sort(), range);
            return new AggregateResult(page.rows(), result.globalTotals(), page.totalCount(),
                    range.from(), range.to(), plan.kind(), plan.reason(), plan.degraded(), snapshot.getVersion());
        });
    }

    /* ------------------------------------------------------------------ */
    /* charts                                                               */
    /* ------------------------------------------------------------------ */

    public ChartResult<ChartAggregates> charts(ChartQuery query) {
        int topN = bounded("top_n", query.getTopN(), properties.getDefaultTopN(), properties.getMaxTopN());
        QueryRequest request = prepare(query.getFilters(), null, SortSpec.DEFAULT);
        return runWithBudget("charts", () -> {
            Snapshot snapshot = request.snapshot();
            QueryPlan plan = queryPlanner.plan(request.chips(), null, snapshot.getManifest());
            return new ChartResult<>(chartAggregator.charts(snapshot, plan, request.chips(), topN),
                    plan.kind(), snapshot.getVersion());
        });
    }

    public ChartResult<ValueDistribution> valueDistribution(DistributionQuery query) {
        int bins = bounded("num_bins", query.getNumBins(), properties.getDefaultBins(), properties.getMaxBins());
        QueryRequest request = prepare(query.getFilters(), null, SortSpec.DEFAULT);
        return runWithBudget("valueDistribution", () -> {
            Snapshot snapshot = request.snapshot();
            QueryPlan plan = queryPlanner.plan(request.chips(), null, snapshot.getManifest());
            return new ChartResult<>(chartAggregator.valueDistribution(snapshot, plan, request.chips(), bins),
                    plan.kind(), snapshot.getVersion());
        });
    }

    /* ------------------------------------------------------------------ */
    /* export                                                               */
    /* ------------------------------------------------------------------ */

    public ExportEstimate estimateExport(ExportQuery query) {
        ExportRequest request = prepareExport(query);
        return runWithBudget("estimateExport", () -> exportStreamer.estimate(request));
    }

    /**
     * Validates, normalizes and plans an export so that bad input is rejected before any output is
     * written.
     */
    public ExportRequest prepareExport(ExportQuery query) {
        ExportFormat format = ExportFormat.fromKey(query.getFormat());
        RankRange range = rankRange(query.getRankFrom(), query.getRankTo(), false);
        QueryRequest request = prepare(query.getFilters(), query.getTargetDimension(), sort(query.getSort()));
        if (request.target() == null && range != null) {
            throw new FilterValidationException("rank_from", range.from(), "rank ranges apply to aggregated exports only");
        }
        QueryPlan plan = queryPlanner.plan(request.chips(), request.target(), request.snapshot().getManifest());
        return new ExportRequest(request.snapshot(), request.chips(), plan, request.sort(), range, format);
    }

    /**
     * Streams a prepared export into {@code sink}. When the job carries no estimate yet, the exact
     * row count is computed first so that progress can be reported.
     *
     * @return rows written
     * @throws com.di.awardscope.export.ExportCancelledException when cancelled or the client went away
     */
    public long export(ExportRequest request, Writer sink, ExportJob job, ExportProgressListener listener) {
        if (job.getEstimatedRows() < 0) {
            job.setEstimatedRows(exportStreamer.estimate(request).rowCount());
        }
        return exportStreamer.stream(request, sink, job, listener != null ? listener : ExportProgressListener.NONE);
    }

    /* ------------------------------------------------------------------ */
    /* filter options                                                       */
    /* ------------------------------------------------------------------ */

    public FilterOptions filterOptions() {
        Snapshot snapshot = snapshotStore.current();
        return runWithBudget("filterOptions", snapshot::filterOptions);
    }

    /* ------------------------------------------------------------------ */
    /* Boundary validation                                                  */
    /* ------------------------------------------------------------------ */

    private QueryRequest prepare(RawFilterRequest filters, String targetKey, SortSpec sort) {
        EntityDimension target = targetDimension(targetKey);
        Snapshot snapshot = snapshotStore.current();
        FilterChipSet chips = filterNormalizer.normalize(filters, DatasetBounds.of(snapshot.getManifest()));
        return new QueryRequest(snapshot, chips, target, sort);
    }

    static EntityDimension targetDimension(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        try {
            return EntityDimension.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException("target_dimension", key, "unknown entity dimension", e);
        }
    }

    private static SortSpec sort(SortRequest sort) {
        return sort == null ? SortSpec.DEFAULT : SortSpec.of(sort.getField(), sort.getDirection());
    }

    private void checkWindow(int offset, int limit) {
        if (offset < 0) {
            throw new FilterValidationException("offset", offset, "must not be negative");
        }
        if (limit < 1 || limit > properties.getMaxPageSize()) {
            throw new FilterValidationException("limit", limit, "must be between 1 and " + properties.getMaxPageSize());
        }
    }

    private static int bounded(String field, Integer value, int defaultValue, int max) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 1 || value > max) {
            throw new FilterValidationException(field, value, "must be between 1 and " + max);
        }
        return value;
    }

    /**
     * Validates a rank range. With {@code required} a missing range defaults to the first
     * {@code default-limit} ranks; otherwise a missing range means the whole result.
     */
    private RankRange rankRange(Integer from, Integer to, boolean required) {
        if (from == null && to == null) {
            return required ? new RankRange(1, properties.getDefaultLimit()) : null;
        }
        int f = from != null ? from : 1;
        if (f < 1) {
            throw new FilterValidationException("rank_from", f, "must be at least 1");
        }
        int t = to != null ? to : f + properties.getDefaultLimit() - 1;
        if (t < f) {
            throw new FilterValidationException("rank_to", t, "must not be less than rank_from " + f);
        }
        if ((long) t - f + 1 > properties.getMaxRankWindow()) {
            throw new FilterValidationException("rank_to", t,
                    "rank window must not exceed " + properties.getMaxRankWindow() + " ranks");
        }
        return new RankRange(f, t);
    }

    /* ------------------------------------------------------------------ */
    /* Wall-clock budget                                                    */
    /* ------------------------------------------------------------------ */

    <T> T runWithBudget(String operation, Callable<T> task) {
        long start = System.currentTimeMillis();
        Future<T> future = queryExecutor.submit(task);
        try {
            T result = future.get(properties.getTimeoutMs(), TimeUnit.MILLISECONDS);
            metricsCollector.recordQuery(System.currentTimeMillis() - start);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsCollector.recordQueryTimeout();
            log.warn("[QUERY] {} exceeded {} ms; worker interrupted", operation, properties.getTimeoutMs());
            throw new QueryTimeoutException(operation, properties.getTimeoutMs());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted while waiting for its worker");
        } catch (ExecutionException e) {
            metricsCollector.recordQueryError();
            Throwable cause = e.getCause();
            if (cause instanceof InternalInconsistencyException ie) {
                metricsCollector.recordInconsistency();
                log.error("[QUERY] {} hit a corrupt snapshot: {}", operation, ie.getMessage());
                throw ie;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
