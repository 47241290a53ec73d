package com.di.awardscope.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Point-in-time view of an {@link ExportJob} for status polling. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportJobStatus(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("state") ExportJobState state,
        @JsonProperty("rows_emitted") long rowsEmitted,
        @JsonProperty("estimated_rows") long estimatedRows,
        @JsonProperty("progress") double progress,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("error") String error) {
}
