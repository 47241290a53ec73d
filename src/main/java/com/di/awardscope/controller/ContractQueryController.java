package com.di.awardscope.controller;

import com.di.awardscope.export.ExportCancelledException;
import com.di.awardscope.export.ExportEstimate;
import com.di.awardscope.export.ExportJob;
import com.di.awardscope.export.ExportJobRegistry;
import com.di.awardscope.export.ExportJobStatus;
import com.di.awardscope.export.ExportRequest;
import com.di.awardscope.query.AggregateQuery;
import com.di.awardscope.aggregate.ChartAggregates;
import com.di.awardscope.aggregate.ValueDistribution;
import com.di.awardscope.query.AggregateResult;
import com.di.awardscope.query.ChartQuery;
import com.di.awardscope.query.ChartResult;
import com.di.awardscope.query.DistributionQuery;
import com.di.awardscope.query.ExportQuery;
import com.di.awardscope.query.QueryService;
import com.di.awardscope.query.SearchQuery;
import com.di.awardscope.query.SearchResult;
import com.di.awardscope.snapshot.FilterOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Search, ranked aggregation and export over the active snapshot.
 * Use with context path: e.g. POST /awardscope/api/contracts/aggregate
 */
@Slf4j
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
public class ContractQueryController {

    public static final String JOB_ID_HEADER = "X-Export-Job-Id";

    private final QueryService queryService;
    private final ExportJobRegistry exportJobRegistry;

    /**
     * Raw facts when {@code target_dimension} is absent, ranked aggregates otherwise.
     */
    @PostMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SearchResult> search(@RequestBody(required = false) SearchQuery query) {
        return ResponseEntity.ok(queryService.search(query != null ? query : new SearchQuery()));
    }

    @PostMapping(value = "/aggregate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AggregateResult> aggregate(@RequestBody AggregateQuery query) {
        return ResponseEntity.ok(queryService.aggregate(query));
    }

    /** Summary, yearly and monthly series and top entities per dimension for the chart panels. */
    @PostMapping(value = "/charts", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChartResult<ChartAggregates>> charts(@RequestBody(required = false) ChartQuery query) {
        return ResponseEntity.ok(queryService.charts(query != null ? query : new ChartQuery()));
    }

    @PostMapping(value = "/value-distribution", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChartResult<ValueDistribution>> valueDistribution(
            @RequestBody(required = false) DistributionQuery query) {
        return ResponseEntity.ok(queryService.valueDistribution(query != null ? query : new DistributionQuery()));
    }

    @PostMapping(value = "/export/estimate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportEstimate> estimateExport(@RequestBody(required = false) ExportQuery query) {
        return ResponseEntity.ok(queryService.estimateExport(query != null ? query : new ExportQuery()));
    }

    /**
     * Streams the export as delimited text. Input is validated before the response is committed;
     * once streaming has started, cancellation or a client disconnect ends the body early.
     */
    @PostMapping("/export")
    public ResponseEntity<StreamingResponseBody> export(@RequestBody(required = false) ExportQuery query) {
        ExportRequest request = queryService.prepareExport(query != null ? query : new ExportQuery());
        ExportJob job = exportJobRegistry.create();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        StreamingResponseBody body = out -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            MDC.put("exportJobId", job.getId());
            try {
                Writer sink = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                queryService.export(request, sink, job, null);
                sink.flush();
            } catch (ExportCancelledException e) {
                log.info("[EXPORT] Job {} ended early after {} rows: {}", e.getJobId(), e.getRowsEmitted(), e.getMessage());
            } finally {
                MDC.clear();
            }
        };
        String dimension = request.plan().targetDimension() != null ? request.plan().targetDimension().getKey() : "raw";
        String fileName = "contracts-" + dimension + "-" + request.snapshot().getVersion() + "." + request.format().getKey();
        return ResponseEntity.ok()
                .header(JOB_ID_HEADER, job.getId())
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(MediaType.parseMediaType(request.format().getMediaType() + ";charset=UTF-8"))
                .body(body);
    }

    @GetMapping(value = "/exports/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportJobStatus> exportStatus(@PathVariable String jobId) {
        return exportJobRegistry.find(jobId)
                .map(job -> ResponseEntity.ok(job.status()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** Requests cancellation; the stream stops at its next batch boundary. */
    @DeleteMapping(value = "/exports/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportJobStatus> cancelExport(@PathVariable String jobId) {
        return exportJobRegistry.cancel(jobId)
                .map(job -> ResponseEntity.accepted().body(job.status()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/filter-options", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FilterOptions> filterOptions() {
        return ResponseEntity.ok(queryService.filterOptions());
    }
}
